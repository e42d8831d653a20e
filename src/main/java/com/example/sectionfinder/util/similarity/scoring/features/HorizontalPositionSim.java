package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

/**
 * 特征：水平位置（列对齐）
 *
 * 计算逻辑：
 * - 左边界差小于同列容差（20px）返回 1.0
 * - 否则线性衰减：max(0, 1 - diff / 200)
 *
 * 同列的候选即使文本不同也会得到较高分
 */
public class HorizontalPositionSim implements Feature {

    @Override
    public String name() {
        return ScoringConfig.HORIZONTAL_POSITION;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        ScoringConfig config = context.getConfig();
        double diff = Math.abs(reference.getLeft() - candidate.getLeft());

        if (diff < config.COLUMN_TOLERANCE_PX) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - diff / config.HORIZONTAL_FALLOFF_PX);
    }
}
