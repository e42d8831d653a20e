package com.example.sectionfinder.util.similarity.source;

import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.Rect;

/**
 * 默认坐标换算器
 *
 * <h3>坐标系说明</h3>
 * <ul>
 *   <li><b>视口像素坐标</b>: 左上角为原点，y 轴向下，单位为当前缩放下的像素</li>
 *   <li><b>归一化坐标</b>: 记录 (x1, y1, x2, y2) 以及记录时的参考尺寸 (width, height)，
 *     与缩放无关</li>
 * </ul>
 *
 * 换算公式：
 * <pre>
 *   toNormalized: x1 = left, y1 = top, x2 = right, y2 = bottom, width/height = 视口尺寸
 *   toPixels:     left = viewport.width * x1 / width，其余同理
 * </pre>
 */
public class ScaledViewportConverter implements ViewportConverter {

    @Override
    public NormalizedRect toNormalized(Rect rect, PageViewport viewport, int pageNumber) {
        return new NormalizedRect(
                rect.getLeft(),
                rect.getTop(),
                rect.right(),
                rect.bottom(),
                viewport.getWidth(),
                viewport.getHeight(),
                pageNumber);
    }

    /**
     * @throws IllegalArgumentException 归一化矩形缺少参考尺寸
     */
    @Override
    public Rect toPixels(NormalizedRect normalizedRect, PageViewport viewport) {
        if (!normalizedRect.hasDimensions()) {
            throw new IllegalArgumentException("归一化矩形缺少参考尺寸: " + normalizedRect);
        }

        double scaleX = viewport.getWidth() / normalizedRect.getWidth();
        double scaleY = viewport.getHeight() / normalizedRect.getHeight();

        double left = normalizedRect.getX1() * scaleX;
        double top = normalizedRect.getY1() * scaleY;
        double right = normalizedRect.getX2() * scaleX;
        double bottom = normalizedRect.getY2() * scaleY;

        return Rect.fromEdges(left, top, right, bottom);
    }
}
