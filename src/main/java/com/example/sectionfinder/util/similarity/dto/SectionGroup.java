package com.example.sectionfinder.util.similarity.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分组：被视为一个逻辑行/段落的一组片段
 *
 * 由一次聚类创建后不可变：
 * - bounds 为所有片段边界的最小外接矩形
 * - text 为片段文本以单个空格拼接（保持顺序）
 * - pageNumber 与所有片段一致
 */
public final class SectionGroup {

    private final List<TextFragment> fragments;
    private final Rect bounds;
    private final String text;
    private final int pageNumber;
    private final Signature signature;

    public SectionGroup(List<TextFragment> fragments, Rect bounds, String text, int pageNumber, Signature signature) {
        this.fragments = Collections.unmodifiableList(new ArrayList<>(fragments));
        this.bounds = bounds;
        this.text = text;
        this.pageNumber = pageNumber;
        this.signature = signature;
    }

    public List<TextFragment> getFragments() {
        return fragments;
    }

    public Rect getBounds() {
        return bounds;
    }

    public String getText() {
        return text;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public Signature getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return String.format("SectionGroup{page=%d, fragments=%d, text='%s', bounds=%s}",
                pageNumber, fragments.size(), abbreviate(text, 40), bounds);
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
