package com.example.sectionfinder.util.similarity.source;

import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.Rect;

/**
 * 视口像素坐标与归一化坐标之间的换算
 */
public interface ViewportConverter {

    NormalizedRect toNormalized(Rect rect, PageViewport viewport, int pageNumber);

    Rect toPixels(NormalizedRect normalizedRect, PageViewport viewport);
}
