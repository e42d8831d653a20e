package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.dto.TextFragment;

import java.util.List;

/**
 * 结构签名构建器（纯函数，O(n)）
 *
 * - avgFontSize：片段字号算术平均
 * - fontFamily：第一个出现的字体族（不做多数投票）
 * - bold：任一片段为粗体即为粗体
 * - textLength：片段文本长度之和（不含拼接空格）
 * - left / lineHeight：取自分组外接矩形
 */
public final class SignatureBuilder {

    private SignatureBuilder() {
    }

    public static Signature buildSignature(List<TextFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return Signature.EMPTY;
        }

        String fontFamily = fragments.get(0).getFontFamily();
        double fontSizeSum = 0.0;
        boolean bold = false;
        int textLength = 0;

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (TextFragment f : fragments) {
            fontSizeSum += f.getFontSize();
            bold |= f.isBold();
            textLength += f.getText().length();

            Rect b = f.getBounds();
            minX = Math.min(minX, b.getLeft());
            minY = Math.min(minY, b.getTop());
            maxY = Math.max(maxY, b.bottom());
        }

        return new Signature(
                fragments.size(),
                fontFamily,
                (float) (fontSizeSum / fragments.size()),
                bold,
                textLength,
                (float) (maxY - minY),
                (float) minX);
    }
}
