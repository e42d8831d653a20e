package com.example.sectionfinder.util.similarity.scoring;

import com.example.sectionfinder.util.similarity.TextUtils;
import com.example.sectionfinder.util.similarity.dto.SectionGroup;
import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.features.BoldMatch;
import com.example.sectionfinder.util.similarity.scoring.features.ElementCountSim;
import com.example.sectionfinder.util.similarity.scoring.features.FontFamilyMatch;
import com.example.sectionfinder.util.similarity.scoring.features.FontSizeSim;
import com.example.sectionfinder.util.similarity.scoring.features.HorizontalPositionSim;
import com.example.sectionfinder.util.similarity.scoring.features.LineHeightSim;
import com.example.sectionfinder.util.similarity.scoring.features.TextOverlapSim;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 签名打分器
 *
 * 使用加权线性组合计算相似度，并按实际累加的权重归一化：
 * score = Σ(weight_i * feature_i) / Σ(weight_i)
 *
 * 跨列门限：水平位置得分 < 0.8（不同列）时，还要求双方长词（长度 > 3）的
 * Jaccard 相似度 >= 0.15，否则直接返回 0
 */
public class SignatureScorer {

    private static final Logger log = LoggerFactory.getLogger(SignatureScorer.class);

    private final ScoringConfig config;
    private final Feature horizontalPosition;
    private final List<Feature> features;

    public SignatureScorer() {
        this(ScoringConfig.loadDefault());
    }

    public SignatureScorer(ScoringConfig config) {
        this.config = config;
        this.horizontalPosition = new HorizontalPositionSim();
        this.features = new ArrayList<>();

        // 注册所有特征
        features.add(horizontalPosition);
        features.add(new ElementCountSim());
        features.add(new FontSizeSim());
        features.add(new TextOverlapSim());
        features.add(new LineHeightSim());
        features.add(new FontFamilyMatch());
        features.add(new BoldMatch());
    }

    /**
     * 比较两个分组
     */
    public double score(SectionGroup reference, SectionGroup candidate) {
        return score(reference.getSignature(), candidate.getSignature(), reference.getText(), candidate.getText());
    }

    /**
     * 计算相似度
     *
     * @param reference 参考签名
     * @param candidate 候选签名
     * @param referenceText 参考文本（可为 null）
     * @param candidateText 候选文本（可为 null）
     * @return 得分 [0, 1]；退化签名（elementCount = 0）返回 0
     */
    public double score(Signature reference, Signature candidate, String referenceText, String candidateText) {
        if (reference == null || candidate == null || reference.isDegenerate() || candidate.isDegenerate()) {
            return 0.0;
        }

        ScoringContext context = new ScoringContext(referenceText, candidateText, config);

        double totalScore = 0.0;
        double totalWeight = 0.0;
        double horizontal = 0.0;

        for (Feature feature : features) {
            double featureValue = feature.value(reference, candidate, context);
            double weight = config.getWeight(feature.name());
            totalScore += weight * featureValue;
            totalWeight += weight;

            if (feature == horizontalPosition) {
                horizontal = featureValue;
            }
        }

        double finalScore = totalWeight > 0 ? totalScore / totalWeight : 0.0;

        if (horizontal < config.SAME_COLUMN_MIN_SCORE && rejectedByColumnGate(context)) {
            if (log.isDebugEnabled()) {
                log.debug("跨列且词重叠不足，拒绝: ref='{}', cand='{}', horizontal={}",
                        abbreviate(referenceText), abbreviate(candidateText), String.format("%.3f", horizontal));
            }
            return 0.0;
        }

        return Math.max(0.0, Math.min(1.0, finalScore));
    }

    /**
     * 跨列门限：长词集合为空时 Jaccard 记为 0（双方都为空也一样），候选被拒绝
     *
     * 未提供文本时只比较签名，不做判定
     */
    private boolean rejectedByColumnGate(ScoringContext context) {
        if (!context.hasTexts()) {
            return false;
        }

        Set<String> words1 = TextUtils.significantWords(context.getReferenceText(), config.GATE_WORD_MIN_LENGTH);
        Set<String> words2 = TextUtils.significantWords(context.getCandidateText(), config.GATE_WORD_MIN_LENGTH);
        return TextUtils.jaccard(words1, words2) < config.CROSS_COLUMN_MIN_WORD_OVERLAP;
    }

    public ScoringConfig getConfig() {
        return config;
    }

    public List<Feature> getFeatures() {
        return Collections.unmodifiableList(features);
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= 30 ? s : s.substring(0, 30);
    }
}
