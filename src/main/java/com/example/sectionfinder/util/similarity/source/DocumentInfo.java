package com.example.sectionfinder.util.similarity.source;

import com.example.sectionfinder.util.similarity.dto.PageViewport;

import java.util.Optional;

/**
 * 文档信息：总页数与每页视口尺寸
 */
public interface DocumentInfo {

    int getTotalPages();

    /**
     * @param pageNumber 页码（从 1 开始）
     * @return 该页视口；页不存在或尚无视口时为空
     */
    Optional<PageViewport> viewportFor(int pageNumber);
}
