package com.example.sectionfinder.config;

import com.example.sectionfinder.util.similarity.GroupedPageCache;
import com.example.sectionfinder.util.similarity.NgramTextMatcher;
import com.example.sectionfinder.util.similarity.SectionGrouper;
import com.example.sectionfinder.util.similarity.scoring.ScoringConfig;
import com.example.sectionfinder.util.similarity.scoring.SignatureScorer;
import com.example.sectionfinder.util.similarity.source.ScaledViewportConverter;
import com.example.sectionfinder.util.similarity.source.ViewportConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 相似搜索引擎组件装配
 *
 * 所有参数都可在 application.yml 的 section-finder.* 下覆盖
 */
@Slf4j
@Configuration
public class SectionFinderConfig {

    @Value("${section-finder.grouping.max-line-gap:30}")
    private double maxLineGap;

    @Value("${section-finder.grouping.max-column-gap:150}")
    private double maxColumnGap;

    @Value("${section-finder.cache.max-entries:500}")
    private int cacheMaxEntries;

    /**
     * 打分配置 JSON 路径，为空时使用内置默认值
     */
    @Value("${section-finder.scoring.config-path:}")
    private String scoringConfigPath;

    @Bean
    public SectionGrouper sectionGrouper() {
        return new SectionGrouper(maxLineGap, maxColumnGap);
    }

    @Bean
    public ScoringConfig scoringConfig() {
        if (scoringConfigPath == null || scoringConfigPath.trim().isEmpty()) {
            return ScoringConfig.loadDefault();
        }
        log.info("加载打分配置: {}", scoringConfigPath);
        return ScoringConfig.loadFromJson(scoringConfigPath.trim());
    }

    @Bean
    public SignatureScorer signatureScorer(ScoringConfig scoringConfig) {
        return new SignatureScorer(scoringConfig);
    }

    @Bean
    public GroupedPageCache groupedPageCache() {
        return new GroupedPageCache(cacheMaxEntries);
    }

    @Bean
    public ViewportConverter viewportConverter() {
        return new ScaledViewportConverter();
    }

    @Bean
    public NgramTextMatcher ngramTextMatcher() {
        return new NgramTextMatcher();
    }
}
