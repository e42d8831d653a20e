package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.SectionGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 页面分组缓存（有界 LRU）
 *
 * 核心思想：
 * - key 为页面内容指纹（{@link PageFingerprint}），内容不变则复用分组结果
 * - 超过 maxEntries 时淘汰最久未访问的条目
 *
 * 由调用方持有并注入搜索器；线程安全
 */
public class GroupedPageCache {

    private static final Logger log = LoggerFactory.getLogger(GroupedPageCache.class);

    private final int maxEntries;
    private final Map<String, List<SectionGroup>> cache;

    /**
     * 统计信息
     */
    private long cacheHits = 0;
    private long cacheMisses = 0;
    private long evictions = 0;

    public GroupedPageCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.cache = new LinkedHashMap<String, List<SectionGroup>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<SectionGroup>> eldest) {
                boolean evict = size() > GroupedPageCache.this.maxEntries;
                if (evict) {
                    evictions++;
                    log.debug("淘汰页面分组缓存: {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    /**
     * 获取指纹对应的分组；未命中时调用 loader 计算并缓存
     */
    public synchronized List<SectionGroup> getOrCompute(String fingerprint, Supplier<List<SectionGroup>> loader) {
        List<SectionGroup> groups = cache.get(fingerprint);
        if (groups != null) {
            cacheHits++;
            return groups;
        }

        cacheMisses++;
        groups = Collections.unmodifiableList(loader.get());
        cache.put(fingerprint, groups);
        return groups;
    }

    public synchronized boolean contains(String fingerprint) {
        return cache.containsKey(fingerprint);
    }

    public synchronized int size() {
        return cache.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public synchronized long getCacheHits() {
        return cacheHits;
    }

    public synchronized long getCacheMisses() {
        return cacheMisses;
    }

    /**
     * 获取缓存统计信息
     */
    public synchronized String getStats() {
        long totalRequests = cacheHits + cacheMisses;
        double hitRate = totalRequests > 0 ? (cacheHits * 100.0 / totalRequests) : 0;
        return String.format("GroupedPageCache Stats: entries=%d/%d, hits=%d, misses=%d, hitRate=%.1f%%, evictions=%d",
                cache.size(), maxEntries, cacheHits, cacheMisses, hitRate, evictions);
    }

    /**
     * 清空缓存
     */
    public synchronized void clear() {
        cache.clear();
        cacheHits = 0;
        cacheMisses = 0;
        evictions = 0;
    }
}
