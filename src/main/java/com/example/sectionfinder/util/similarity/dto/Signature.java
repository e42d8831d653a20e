package com.example.sectionfinder.util.similarity.dto;

/**
 * 分组的结构签名（用于低成本比较）
 *
 * 纯派生数据，随分组一起创建，不单独修改
 */
public final class Signature {

    public static final Signature EMPTY = new Signature(0, "", 0f, false, 0, 0f, 0f);

    private final int elementCount;
    private final String fontFamily;
    private final float avgFontSize;
    private final boolean bold;
    private final int textLength;
    private final float lineHeight;
    private final float left;

    public Signature(int elementCount, String fontFamily, float avgFontSize, boolean bold,
                     int textLength, float lineHeight, float left) {
        this.elementCount = elementCount;
        this.fontFamily = fontFamily == null ? "" : fontFamily;
        this.avgFontSize = avgFontSize;
        this.bold = bold;
        this.textLength = textLength;
        this.lineHeight = lineHeight;
        this.left = left;
    }

    public int getElementCount() {
        return elementCount;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public float getAvgFontSize() {
        return avgFontSize;
    }

    public boolean isBold() {
        return bold;
    }

    public int getTextLength() {
        return textLength;
    }

    public float getLineHeight() {
        return lineHeight;
    }

    public float getLeft() {
        return left;
    }

    public boolean isDegenerate() {
        return elementCount <= 0;
    }

    @Override
    public String toString() {
        return String.format("Signature{count=%d, font='%s', size=%.2f, bold=%s, len=%d, lineHeight=%.2f, left=%.2f}",
                elementCount, fontFamily, avgFontSize, bold, textLength, lineHeight, left);
    }
}
