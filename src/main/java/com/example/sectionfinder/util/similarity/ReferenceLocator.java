package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.SectionGroup;
import com.example.sectionfinder.util.similarity.source.ViewportConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;

/**
 * 参考分组定位器
 *
 * 把用户选区的归一化外接矩形换算到页面像素空间，
 * 在该页分组中找 IoU 严格最大（且 > 0）的分组
 */
public class ReferenceLocator {

    private static final Logger log = LoggerFactory.getLogger(ReferenceLocator.class);

    private final ViewportConverter converter;

    public ReferenceLocator(ViewportConverter converter) {
        this.converter = converter;
    }

    /**
     * @param groups 候选分组（可包含其他页，仅比较 pageNumber 页）
     * @param pageNumber 选区所在页
     * @param target 选区归一化位置
     * @param viewport 该页视口
     * @return 最佳分组；位置缺少尺寸或无重叠时为空
     */
    public Optional<SectionGroup> locate(Collection<SectionGroup> groups, int pageNumber,
                                         NormalizedPosition target, PageViewport viewport) {
        if (target == null || target.getBoundingRect() == null || !target.getBoundingRect().hasDimensions()) {
            log.warn("选区位置缺少尺寸信息，无法定位参考分组: {}", target);
            return Optional.empty();
        }

        Rect targetRect = converter.toPixels(target.getBoundingRect(), viewport);

        SectionGroup bestMatch = null;
        double bestOverlap = 0.0;

        for (SectionGroup group : groups) {
            if (group.getPageNumber() != pageNumber) {
                continue;
            }

            double overlap = targetRect.iou(group.getBounds());
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
                bestMatch = group;
            }
        }

        if (bestMatch == null) {
            log.warn("页面 {} 未找到与选区重叠的分组, targetRect={}", pageNumber, targetRect);
            return Optional.empty();
        }

        log.debug("参考分组: text='{}', IoU={}", bestMatch.getText(), String.format("%.3f", bestOverlap));
        return Optional.of(bestMatch);
    }
}
