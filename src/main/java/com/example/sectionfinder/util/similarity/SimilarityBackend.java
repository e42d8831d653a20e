package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.SimilarityResult;

import java.util.List;

/**
 * 相似区段搜索后端
 *
 * - {@link SimilarSectionFinder}：基于版面（几何 + 样式 + 文本）的结构匹配
 * - {@link NgramSectionFinder}：仅基于文本流的 N-gram 匹配
 */
public interface SimilarityBackend {

    /**
     * @param options 搜索参数
     * @return 按得分降序的结果；输入不合格或未找到参考时返回空列表
     * @throws IllegalArgumentException 参数本身非法（如 maxResults <= 0）
     */
    List<SimilarityResult> findSimilarSections(SearchOptions options);
}
