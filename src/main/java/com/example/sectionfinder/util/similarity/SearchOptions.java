package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import lombok.Builder;
import lombok.Getter;

/**
 * 相似区段搜索参数
 */
@Getter
@Builder(toBuilder = true)
public class SearchOptions {

    public static final double DEFAULT_THRESHOLD = 0.60;
    public static final int DEFAULT_MAX_RESULTS = 20;
    public static final int DEFAULT_MAX_PAGES = 50;

    /** 选中文本 */
    private final String selectedText;

    /** 选区归一化位置 */
    private final NormalizedPosition selectedPosition;

    /** 最低得分 [0, 1] */
    @Builder.Default
    private final double threshold = DEFAULT_THRESHOLD;

    /** 最多返回结果数（> 0） */
    @Builder.Default
    private final int maxResults = DEFAULT_MAX_RESULTS;

    /** 搜索页窗口大小（> 0） */
    @Builder.Default
    private final int maxPages = DEFAULT_MAX_PAGES;

    /** 进度回调（可为 null） */
    private final ProgressListener progressListener;

    public ProgressListener progress() {
        return progressListener == null ? ProgressListener.NONE : progressListener;
    }

    /**
     * 校验参数取值（编程错误直接抛出）
     *
     * @throws IllegalArgumentException 参数越界
     */
    public void validate() {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold 必须在 [0, 1] 内: " + threshold);
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults 必须为正: " + maxResults);
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages 必须为正: " + maxPages);
        }
    }
}
