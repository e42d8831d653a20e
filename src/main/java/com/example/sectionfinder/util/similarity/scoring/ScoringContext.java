package com.example.sectionfinder.util.similarity.scoring;

/**
 * 打分上下文
 *
 * 提供特征计算所需的附加信息：
 * - 参考/候选文本（可能为 null，此时文本特征退化为长度比）
 * - 配置参数
 */
public class ScoringContext {

    private final String referenceText;
    private final String candidateText;
    private final ScoringConfig config;

    public ScoringContext(String referenceText, String candidateText, ScoringConfig config) {
        this.referenceText = referenceText;
        this.candidateText = candidateText;
        this.config = config;
    }

    public String getReferenceText() {
        return referenceText;
    }

    public String getCandidateText() {
        return candidateText;
    }

    public ScoringConfig getConfig() {
        return config;
    }

    public boolean hasTexts() {
        return referenceText != null && candidateText != null;
    }

    /**
     * 相对差 |a-b| / max(|a|,|b|)
     *
     * 两者相等（含同为 0）时为 0；仅一方为 0 时为 1（完全不同）
     */
    public static double relativeDifference(double a, double b) {
        if (a == b) {
            return 0.0;
        }
        double max = Math.max(Math.abs(a), Math.abs(b));
        return Math.min(1.0, Math.abs(a - b) / max);
    }

    /**
     * 较短/较长之比，同为 0 时为 1
     */
    public static double lengthRatio(int a, int b) {
        int max = Math.max(a, b);
        if (max <= 0) {
            return 1.0;
        }
        return (double) Math.min(a, b) / max;
    }
}
