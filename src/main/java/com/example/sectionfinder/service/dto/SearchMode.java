package com.example.sectionfinder.service.dto;

/**
 * 搜索后端
 */
public enum SearchMode {
    /** 版面签名比较 */
    LAYOUT,
    /** n-gram 文本比较 */
    TEXT
}
