package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

/**
 * 特征：片段数量比例
 *
 * 1 - min(2 * |a-b| / max(a,b), 1)，允许约 2 倍以内的差异
 */
public class ElementCountSim implements Feature {

    @Override
    public String name() {
        return ScoringConfig.ELEMENT_COUNT;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        double diff = ScoringContext.relativeDifference(reference.getElementCount(), candidate.getElementCount());
        return 1.0 - Math.min(diff * context.getConfig().ELEMENT_COUNT_DIFF_FACTOR, 1.0);
    }
}
