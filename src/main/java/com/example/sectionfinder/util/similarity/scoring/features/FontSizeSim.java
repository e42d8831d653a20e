package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

/**
 * 特征：平均字号相似度
 *
 * 1 - min(3 * |a-b| / max(a,b), 1)
 */
public class FontSizeSim implements Feature {

    @Override
    public String name() {
        return ScoringConfig.FONT_SIZE;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        double diff = ScoringContext.relativeDifference(reference.getAvgFontSize(), candidate.getAvgFontSize());
        return 1.0 - Math.min(diff * context.getConfig().FONT_SIZE_DIFF_FACTOR, 1.0);
    }
}
