package com.example.sectionfinder.util.similarity.scoring.features;

import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.scoring.Feature;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.ScoringContext;

import java.util.Locale;

/**
 * 特征：字体族匹配
 *
 * - 完全相同：1.0
 * - 同一粗分类（都含 serif / sans / times / arial）：0.7
 * - 其他：0.0
 */
public class FontFamilyMatch implements Feature {

    private static final String[] FAMILY_CLASSES = {"serif", "sans", "times", "arial"};

    @Override
    public String name() {
        return ScoringConfig.FONT_FAMILY;
    }

    @Override
    public double value(Signature reference, Signature candidate, ScoringContext context) {
        String f1 = reference.getFontFamily();
        String f2 = candidate.getFontFamily();

        if (f1.equals(f2)) {
            return 1.0;
        }

        String lower1 = f1.toLowerCase(Locale.ROOT);
        String lower2 = f2.toLowerCase(Locale.ROOT);
        for (String familyClass : FAMILY_CLASSES) {
            if (lower1.contains(familyClass) && lower2.contains(familyClass)) {
                return context.getConfig().SIMILAR_FONT_FAMILY_SCORE;
            }
        }
        return 0.0;
    }
}
