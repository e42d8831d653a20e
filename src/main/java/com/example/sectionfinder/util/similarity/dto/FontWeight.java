package com.example.sectionfinder.util.similarity.dto;

/**
 * 字重：normal / bold / 数值型（100-900）
 */
public final class FontWeight {

    public static final FontWeight NORMAL = new FontWeight(Kind.NORMAL, 400);
    public static final FontWeight BOLD = new FontWeight(Kind.BOLD, 700);

    /** 数值字重达到该值视为粗体 */
    public static final int BOLD_THRESHOLD = 700;

    public enum Kind {
        NORMAL, BOLD, NUMERIC
    }

    private final Kind kind;
    private final int value;

    private FontWeight(Kind kind, int value) {
        this.kind = kind;
        this.value = value;
    }

    public static FontWeight numeric(int value) {
        return new FontWeight(Kind.NUMERIC, value);
    }

    /**
     * 解析 CSS 风格的字重字符串（"bold"、"normal"、"700"）
     * 无法识别时按 normal 处理
     */
    public static FontWeight parse(String weight) {
        if (weight == null || weight.trim().isEmpty()) {
            return NORMAL;
        }
        String w = weight.trim().toLowerCase();
        if ("bold".equals(w) || "bolder".equals(w)) {
            return BOLD;
        }
        if ("normal".equals(w)) {
            return NORMAL;
        }
        try {
            return numeric(Integer.parseInt(w));
        } catch (NumberFormatException e) {
            return NORMAL;
        }
    }

    public Kind getKind() {
        return kind;
    }

    public int getValue() {
        return value;
    }

    public boolean isBold() {
        return kind == Kind.BOLD || (kind == Kind.NUMERIC && value >= BOLD_THRESHOLD);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FontWeight)) return false;
        FontWeight that = (FontWeight) o;
        return kind == that.kind && value == that.value;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value;
    }

    @Override
    public String toString() {
        return kind == Kind.NUMERIC ? String.valueOf(value) : kind.name().toLowerCase();
    }
}
