package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.TextMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * N-gram 文本匹配器
 *
 * 把搜索文本切成 2~3 词的 n-gram 集合，在语料上以 ±20% 长度的滑动窗口
 * 计算 Jaccard 相似度，保留 >= threshold 的窗口，
 * 再按得分降序去重（5 词容差内重叠的窗口只保留得分最高者）
 */
public class NgramTextMatcher {

    public static final int DEFAULT_MIN_GRAM = 2;
    public static final int DEFAULT_MAX_GRAM = 3;
    public static final double DEFAULT_THRESHOLD = 0.8;

    /** 规范化后搜索文本的最小字符数 */
    public static final int MIN_SEARCH_LENGTH = 15;

    /** 去重时允许的词重叠容差 */
    static final int OVERLAP_TOLERANCE = 5;

    private final int minGram;
    private final int maxGram;

    public NgramTextMatcher() {
        this(DEFAULT_MIN_GRAM, DEFAULT_MAX_GRAM);
    }

    public NgramTextMatcher(int minGram, int maxGram) {
        if (minGram <= 0 || maxGram < minGram) {
            throw new IllegalArgumentException("n-gram 范围非法: [" + minGram + ", " + maxGram + "]");
        }
        this.minGram = minGram;
        this.maxGram = maxGram;
    }

    public List<TextMatch> findSimilarText(String searchText, String corpusText) {
        return findSimilarText(searchText, corpusText, DEFAULT_THRESHOLD);
    }

    /**
     * 在语料中查找与搜索文本相似的片段
     *
     * @return 去重后按得分降序的匹配；词下标基于规范化后的语料
     */
    public List<TextMatch> findSimilarText(String searchText, String corpusText, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("threshold 必须在 [0, 1] 内: " + threshold);
        }

        String normalizedSearch = TextUtils.normalize(searchText);
        if (normalizedSearch.length() < MIN_SEARCH_LENGTH) {
            return Collections.emptyList();
        }

        Set<String> searchTokens = new HashSet<>(tokenizeIntoNgrams(normalizedSearch));
        if (searchTokens.isEmpty()) {
            return Collections.emptyList();
        }

        int searchWordCount = TextUtils.words(normalizedSearch).size();
        List<String> corpusWords = TextUtils.words(corpusText);

        // 窗口长度 floor(0.8n) ~ ceil(1.2n)，整数运算避免浮点误差
        int minLength = Math.max(1, searchWordCount * 4 / 5);
        int maxLength = (searchWordCount * 6 + 4) / 5;

        List<TextMatch> matches = new ArrayList<>();
        for (int i = 0; i <= corpusWords.size() - minLength; i++) {
            for (int windowSize = minLength; windowSize <= maxLength; windowSize++) {
                if (i + windowSize > corpusWords.size()) {
                    break;
                }

                String windowText = String.join(" ", corpusWords.subList(i, i + windowSize));
                double score = jaccard(searchTokens, tokenizeIntoNgrams(windowText));
                if (score >= threshold) {
                    matches.add(new TextMatch(windowText, score, i, i + windowSize));
                }
            }
        }

        return deduplicate(matches);
    }

    /**
     * 生成 minGram~maxGram 个连续词组成的 n-gram
     */
    public List<String> tokenizeIntoNgrams(String text) {
        List<String> words = TextUtils.words(text);
        if (words.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> tokens = new ArrayList<>();
        for (int gramSize = minGram; gramSize <= maxGram; gramSize++) {
            for (int i = 0; i <= words.size() - gramSize; i++) {
                tokens.add(String.join(" ", words.subList(i, i + gramSize)));
            }
        }
        return tokens;
    }

    /**
     * n-gram 集合的 Jaccard 相似度
     */
    public static double jaccard(Iterable<String> tokens1, Iterable<String> tokens2) {
        Set<String> set1 = toSet(tokens1);
        Set<String> set2 = toSet(tokens2);
        return TextUtils.jaccard(set1, set2);
    }

    @SuppressWarnings("unchecked")
    private static Set<String> toSet(Iterable<String> tokens) {
        if (tokens instanceof Set) {
            return (Set<String>) tokens;
        }
        Set<String> set = new HashSet<>();
        tokens.forEach(set::add);
        return set;
    }

    /**
     * 按得分降序保留互不重叠的匹配
     */
    private static List<TextMatch> deduplicate(List<TextMatch> matches) {
        if (matches.isEmpty()) {
            return Collections.emptyList();
        }

        List<TextMatch> sorted = new ArrayList<>(matches);
        sorted.sort(Comparator.comparingDouble(TextMatch::getScore).reversed());

        List<TextMatch> kept = new ArrayList<>();
        for (TextMatch match : sorted) {
            boolean overlaps = false;
            for (TextMatch existing : kept) {
                if (rangesOverlap(match, existing)) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                kept.add(match);
            }
        }
        return kept;
    }

    static boolean rangesOverlap(TextMatch a, TextMatch b) {
        return !(a.getEndWordIndex() + OVERLAP_TOLERANCE < b.getStartWordIndex()
                || a.getStartWordIndex() - OVERLAP_TOLERANCE > b.getEndWordIndex());
    }

    public int getMinGram() {
        return minGram;
    }

    public int getMaxGram() {
        return maxGram;
    }
}
