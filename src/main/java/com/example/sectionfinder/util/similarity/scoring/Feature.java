package com.example.sectionfinder.util.similarity.scoring;

import com.example.sectionfinder.util.similarity.dto.Signature;

/**
 * 相似度特征接口
 *
 * 每个特征独立比较参考分组与候选分组的某一方面，返回值范围 [0, 1]
 * - 0: 完全不同
 * - 1: 完全一致
 *
 * 实现必须对参考/候选对称：value(a, b) == value(b, a)
 */
public interface Feature {

    /**
     * 特征名称（用于权重配置和日志）
     */
    String name();

    /**
     * 计算特征值
     *
     * @param reference 参考分组签名
     * @param candidate 候选分组签名
     * @param context 打分上下文（文本、配置）
     * @return 特征值 [0, 1]
     */
    double value(Signature reference, Signature candidate, ScoringContext context);
}
