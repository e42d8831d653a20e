package com.example.sectionfinder.util.similarity.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 相似度打分全局配置
 *
 * 设计原则：
 * 1. 硬编码默认值（开箱即用）
 * 2. 支持从 JSON 文件部分覆盖
 * 3. 容错回退（JSON 解析失败时使用默认值）
 *
 * 注意：默认权重之和为 1.10，最终得分除以实际累加的权重和（自动归一化）
 */
public class ScoringConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    // ========== 特征名称 ==========

    public static final String HORIZONTAL_POSITION = "horizontal_position";
    public static final String ELEMENT_COUNT = "element_count";
    public static final String FONT_SIZE = "font_size";
    public static final String TEXT_OVERLAP = "text_overlap";
    public static final String LINE_HEIGHT = "line_height";
    public static final String FONT_FAMILY = "font_family";
    public static final String BOLD_MATCH = "bold_match";

    // ========== 水平位置（列对齐） ==========

    /** 左边界差小于该值视为同列（px） */
    public double COLUMN_TOLERANCE_PX = 20.0;

    /** 超出同列容差后的线性衰减跨度（px） */
    public double HORIZONTAL_FALLOFF_PX = 200.0;

    // ========== 比例差放大系数 ==========

    public double ELEMENT_COUNT_DIFF_FACTOR = 2.0;
    public double FONT_SIZE_DIFF_FACTOR = 3.0;
    public double LINE_HEIGHT_DIFF_FACTOR = 2.0;

    // ========== 文本重叠 ==========

    /** 参与文本重叠计算的词最小长度（不含） */
    public int TEXT_WORD_MIN_LENGTH = 2;

    // ========== 字体族 ==========

    /** 同类字体族（serif / sans / times / arial）的部分得分 */
    public double SIMILAR_FONT_FAMILY_SCORE = 0.7;

    // ========== 跨列门限 ==========

    /** 水平位置得分低于该值视为不同列 */
    public double SAME_COLUMN_MIN_SCORE = 0.8;

    /** 不同列时要求的最小词重叠（Jaccard） */
    public double CROSS_COLUMN_MIN_WORD_OVERLAP = 0.15;

    /** 跨列门限使用的词最小长度（不含） */
    public int GATE_WORD_MIN_LENGTH = 3;

    // ========== 特征权重 ==========

    private final Map<String, Double> weights = new LinkedHashMap<>();

    private ScoringConfig() {
        initDefaultWeights();
    }

    private void initDefaultWeights() {
        weights.put(HORIZONTAL_POSITION, 0.25);
        weights.put(ELEMENT_COUNT, 0.10);
        weights.put(FONT_SIZE, 0.15);
        weights.put(TEXT_OVERLAP, 0.15);
        weights.put(LINE_HEIGHT, 0.10);
        weights.put(FONT_FAMILY, 0.20);
        weights.put(BOLD_MATCH, 0.15);
    }

    public double getWeight(String featureName) {
        return weights.getOrDefault(featureName, 0.0);
    }

    public Map<String, Double> getWeights() {
        return new LinkedHashMap<>(weights);
    }

    /**
     * 设置单个特征权重
     *
     * @throws IllegalArgumentException 权重为负
     */
    public ScoringConfig withWeight(String featureName, double weight) {
        if (weight < 0) {
            throw new IllegalArgumentException("特征权重不能为负: " + featureName + "=" + weight);
        }
        weights.put(featureName, weight);
        return this;
    }

    public static ScoringConfig loadDefault() {
        return new ScoringConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static ScoringConfig loadFromJson(String jsonPath) {
        ScoringConfig config = new ScoringConfig();

        try {
            JsonNode json = new ObjectMapper().readTree(new File(jsonPath));
            config.apply(json);
            log.info("已加载打分配置: {}", jsonPath);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("打分配置加载失败，使用默认配置: {} ({})", jsonPath, e.getMessage());
            return new ScoringConfig();
        }

        return config;
    }

    private void apply(JsonNode json) {
        if (json.has("COLUMN_TOLERANCE_PX")) {
            COLUMN_TOLERANCE_PX = json.get("COLUMN_TOLERANCE_PX").asDouble();
        }
        if (json.has("HORIZONTAL_FALLOFF_PX")) {
            HORIZONTAL_FALLOFF_PX = json.get("HORIZONTAL_FALLOFF_PX").asDouble();
        }
        if (json.has("ELEMENT_COUNT_DIFF_FACTOR")) {
            ELEMENT_COUNT_DIFF_FACTOR = json.get("ELEMENT_COUNT_DIFF_FACTOR").asDouble();
        }
        if (json.has("FONT_SIZE_DIFF_FACTOR")) {
            FONT_SIZE_DIFF_FACTOR = json.get("FONT_SIZE_DIFF_FACTOR").asDouble();
        }
        if (json.has("LINE_HEIGHT_DIFF_FACTOR")) {
            LINE_HEIGHT_DIFF_FACTOR = json.get("LINE_HEIGHT_DIFF_FACTOR").asDouble();
        }
        if (json.has("TEXT_WORD_MIN_LENGTH")) {
            TEXT_WORD_MIN_LENGTH = json.get("TEXT_WORD_MIN_LENGTH").asInt();
        }
        if (json.has("SIMILAR_FONT_FAMILY_SCORE")) {
            SIMILAR_FONT_FAMILY_SCORE = json.get("SIMILAR_FONT_FAMILY_SCORE").asDouble();
        }
        if (json.has("SAME_COLUMN_MIN_SCORE")) {
            SAME_COLUMN_MIN_SCORE = json.get("SAME_COLUMN_MIN_SCORE").asDouble();
        }
        if (json.has("CROSS_COLUMN_MIN_WORD_OVERLAP")) {
            CROSS_COLUMN_MIN_WORD_OVERLAP = json.get("CROSS_COLUMN_MIN_WORD_OVERLAP").asDouble();
        }
        if (json.has("GATE_WORD_MIN_LENGTH")) {
            GATE_WORD_MIN_LENGTH = json.get("GATE_WORD_MIN_LENGTH").asInt();
        }

        if (json.has("weights")) {
            JsonNode weightsJson = json.get("weights");
            Iterator<String> fieldNames = weightsJson.fieldNames();
            while (fieldNames.hasNext()) {
                String key = fieldNames.next();
                withWeight(key, weightsJson.get(key).asDouble());
            }
        }
    }

    @Override
    public String toString() {
        return "ScoringConfig{" +
                "COLUMN_TOLERANCE_PX=" + COLUMN_TOLERANCE_PX +
                ", HORIZONTAL_FALLOFF_PX=" + HORIZONTAL_FALLOFF_PX +
                ", SAME_COLUMN_MIN_SCORE=" + SAME_COLUMN_MIN_SCORE +
                ", CROSS_COLUMN_MIN_WORD_OVERLAP=" + CROSS_COLUMN_MIN_WORD_OVERLAP +
                ", weights=" + weights +
                "}";
    }
}
