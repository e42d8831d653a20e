package com.example.sectionfinder.util.similarity.dto;

/**
 * 相似区段搜索结果（只读，按得分降序输出）
 */
public final class SimilarityResult {

    private final String text;
    private final double score;
    private final NormalizedPosition position;

    public SimilarityResult(String text, double score, NormalizedPosition position) {
        this.text = text;
        this.score = score;
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public double getScore() {
        return score;
    }

    public NormalizedPosition getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return String.format("SimilarityResult{page=%d, score=%.3f, text='%s'}",
                position == null ? 0 : position.getPageNumber(), score, text);
    }
}
