package com.example.sectionfinder.util.similarity.dto;

/**
 * N-gram 文本匹配结果
 *
 * 词索引基于规范化后的语料词序列，endWordIndex 不包含
 */
public final class TextMatch {

    private final String text;
    private final double score;
    private final int startWordIndex;
    private final int endWordIndex;

    public TextMatch(String text, double score, int startWordIndex, int endWordIndex) {
        this.text = text;
        this.score = score;
        this.startWordIndex = startWordIndex;
        this.endWordIndex = endWordIndex;
    }

    public String getText() {
        return text;
    }

    public double getScore() {
        return score;
    }

    public int getStartWordIndex() {
        return startWordIndex;
    }

    public int getEndWordIndex() {
        return endWordIndex;
    }

    public int wordCount() {
        return endWordIndex - startWordIndex;
    }

    @Override
    public String toString() {
        return String.format("TextMatch{words=[%d,%d), score=%.3f, text='%s'}",
                startWordIndex, endWordIndex, score, text);
    }
}
