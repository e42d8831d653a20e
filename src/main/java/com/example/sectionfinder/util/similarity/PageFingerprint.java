package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.TextFragment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * 页面内容指纹（SHA-256）
 *
 * 覆盖页码以及每个片段的文本、边界、字体、字号、粗体，
 * 任一项变化都会得到不同指纹
 */
public final class PageFingerprint {

    private PageFingerprint() {
    }

    public static String of(int pageNumber, List<TextFragment> fragments) {
        MessageDigest digest = sha256();
        update(digest, "page:" + pageNumber);

        for (TextFragment f : fragments) {
            Rect b = f.getBounds();
            update(digest, f.getText());
            update(digest, b.getLeft() + "," + b.getTop() + "," + b.getWidth() + "," + b.getHeight());
            update(digest, f.getFontFamily() + "|" + f.getFontSize() + "|" + f.getFontWeight() + "|" + f.isBold());
        }

        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // 所有 JDK 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
