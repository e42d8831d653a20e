package com.example.sectionfinder.util.similarity;

/**
 * 搜索进度回调（同步调用，不影响结果正确性）
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total, found) -> { };

    /**
     * @param current 已处理页数
     * @param total 窗口总页数
     * @param found 当前已找到的结果数
     */
    void onProgress(int current, int total, int found);
}
