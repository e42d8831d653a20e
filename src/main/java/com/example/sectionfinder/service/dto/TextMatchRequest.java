package com.example.sectionfinder.service.dto;

import lombok.Data;

/**
 * 纯文本相似匹配请求
 */
@Data
public class TextMatchRequest {

    private String searchText;

    private String corpusText;

    private Double threshold;
}
