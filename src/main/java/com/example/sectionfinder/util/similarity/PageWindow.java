package com.example.sectionfinder.util.similarity;

import java.util.ArrayList;
import java.util.List;

/**
 * 搜索页窗口：以当前页为中心、宽度 maxPages、限制在 [1, totalPages]
 *
 * 靠近首尾时窗口向另一侧平移，尽量仍覆盖 maxPages 页
 */
public final class PageWindow {

    private PageWindow() {
    }

    public static List<Integer> around(int currentPage, int totalPages, int maxPages) {
        List<Integer> pages = new ArrayList<>();
        if (totalPages <= 0 || maxPages <= 0) {
            return pages;
        }

        int startPage = Math.max(1, currentPage - maxPages / 2);
        int endPage = Math.min(totalPages, startPage + maxPages - 1);

        if (endPage - startPage + 1 < maxPages) {
            if (startPage == 1) {
                endPage = Math.min(totalPages, maxPages);
            } else if (endPage == totalPages) {
                startPage = Math.max(1, totalPages - maxPages + 1);
            }
        }

        for (int p = startPage; p <= endPage; p++) {
            pages.add(p);
        }
        return pages;
    }
}
