package com.example.sectionfinder.util.similarity.dto;

/**
 * 文本片段：渲染文本的最小单元（文本 + 像素边界 + 样式）
 *
 * 一次搜索内由提取步骤创建，不可变，不跨页共享
 */
public final class TextFragment {

    private final String text;
    private final Rect bounds;
    private final int pageNumber;
    private final String fontFamily;
    private final float fontSize;
    private final FontWeight fontWeight;
    private final boolean bold;

    public TextFragment(String text, Rect bounds, int pageNumber,
                        String fontFamily, float fontSize, FontWeight fontWeight, boolean bold) {
        this.text = text == null ? "" : text;
        this.bounds = bounds == null ? Rect.EMPTY : bounds;
        this.pageNumber = pageNumber;
        this.fontFamily = fontFamily == null ? "" : fontFamily;
        this.fontSize = fontSize;
        this.fontWeight = fontWeight == null ? FontWeight.NORMAL : fontWeight;
        this.bold = bold;
    }

    /**
     * 粗体标志由字重推导
     */
    public TextFragment(String text, Rect bounds, int pageNumber,
                        String fontFamily, float fontSize, FontWeight fontWeight) {
        this(text, bounds, pageNumber, fontFamily, fontSize, fontWeight,
                fontWeight != null && fontWeight.isBold());
    }

    public String getText() {
        return text;
    }

    public Rect getBounds() {
        return bounds;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public float getFontSize() {
        return fontSize;
    }

    public FontWeight getFontWeight() {
        return fontWeight;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isBlank() {
        return text.trim().isEmpty();
    }

    @Override
    public String toString() {
        return String.format("TextFragment{page=%d, text='%s', bounds=%s, font='%s', size=%.1f, bold=%s}",
                pageNumber, text, bounds, fontFamily, fontSize, bold);
    }
}
