package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.TextUtils;
import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

import java.util.Set;

/**
 * 特征：文本词重叠
 *
 * 计算逻辑：
 * - 双方文本切成小写词（长度 > 2），取 Jaccard 相似度
 * - 任一方没有有效词时，使用文本长度比（短/长）
 * - 未提供文本时，使用长度比的平方根（对长度差更宽容）
 */
public class TextOverlapSim implements Feature {

    @Override
    public String name() {
        return ScoringConfig.TEXT_OVERLAP;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        double lengthRatio = ScoringContext.lengthRatio(reference.getTextLength(), candidate.getTextLength());

        if (!context.hasTexts()) {
            return Math.sqrt(lengthRatio);
        }

        int minLength = context.getConfig().TEXT_WORD_MIN_LENGTH;
        Set<String> words1 = TextUtils.significantWords(context.getReferenceText(), minLength);
        Set<String> words2 = TextUtils.significantWords(context.getCandidateText(), minLength);

        if (words1.isEmpty() || words2.isEmpty()) {
            return lengthRatio;
        }
        return TextUtils.jaccard(words1, words2);
    }
}
