package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.FontWeight;
import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.TextFragment;

/**
 * 测试用片段构造
 */
public final class FragmentFixtures {

    public static final String FONT = "Helvetica";
    public static final float SIZE = 12f;

    private FragmentFixtures() {
    }

    public static TextFragment fragment(String text, double left, double top, double width, double height, int page) {
        return new TextFragment(text, new Rect(left, top, width, height), page, FONT, SIZE, FontWeight.NORMAL);
    }

    public static TextFragment styled(String text, double left, double top, double width, double height, int page,
                                      String font, float size, boolean bold) {
        return new TextFragment(text, new Rect(left, top, width, height), page, font, size,
                bold ? FontWeight.BOLD : FontWeight.NORMAL);
    }
}
