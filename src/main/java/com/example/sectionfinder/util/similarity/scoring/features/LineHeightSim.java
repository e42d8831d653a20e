package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

/**
 * 特征：行高（分组外接矩形高度）相似度
 *
 * 1 - min(2 * |a-b| / max(a,b), 1)
 */
public class LineHeightSim implements Feature {

    @Override
    public String name() {
        return ScoringConfig.LINE_HEIGHT;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        double diff = ScoringContext.relativeDifference(reference.getLineHeight(), candidate.getLineHeight());
        return 1.0 - Math.min(diff * context.getConfig().LINE_HEIGHT_DIFF_FACTOR, 1.0);
    }
}
