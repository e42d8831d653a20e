package com.example.sectionfinder.util.similarity;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 文本规范化、分词与集合相似度工具
 */
public final class TextUtils {

    private TextUtils() {
    }

    /**
     * 小写 + 去首尾空白 + 连续空白折叠为单个空格
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * 规范化后按空格切词
     */
    public static List<String> words(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(normalized.split(" "));
    }

    /**
     * 长度大于 minLengthExclusive 的小写词集合
     */
    public static Set<String> significantWords(String text, int minLengthExclusive) {
        return words(text).stream()
                .filter(w -> w.length() > minLengthExclusive)
                .collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * Jaccard 相似度 = |交集| / |并集|，并集为空时返回 0
     */
    public static double jaccard(Collection<String> tokens1, Collection<String> tokens2) {
        Set<String> set1 = tokens1 instanceof Set ? (Set<String>) tokens1 : new HashSet<>(tokens1);
        Set<String> set2 = tokens2 instanceof Set ? (Set<String>) tokens2 : new HashSet<>(tokens2);

        int intersection = 0;
        for (String token : set1) {
            if (set2.contains(token)) {
                intersection++;
            }
        }

        int union = set1.size() + set2.size() - intersection;
        return union == 0 ? 0.0 : (double) intersection / union;
    }
}
