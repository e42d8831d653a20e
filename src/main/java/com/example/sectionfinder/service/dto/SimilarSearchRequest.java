package com.example.sectionfinder.service.dto;

import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import lombok.Data;

/**
 * 相似区段搜索请求
 *
 * 可选字段为 null 时使用默认值
 */
@Data
public class SimilarSearchRequest {

    private String selectedText;

    private NormalizedPosition selectedPosition;

    private Double threshold;

    private Integer maxResults;

    private Integer maxPages;

    private SearchMode mode;
}
