package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

/**
 * 特征：粗体一致（一致为 1.0，否则 0.0）
 */
public class BoldMatch implements Feature {

    @Override
    public String name() {
        return ScoringConfig.BOLD_MATCH;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        return reference.isBold() == candidate.isBold() ? 1.0 : 0.0;
    }
}
