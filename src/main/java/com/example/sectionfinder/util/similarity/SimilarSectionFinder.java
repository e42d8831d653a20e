package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.SectionGroup;
import com.example.sectionfinder.util.similarity.dto.SimilarityResult;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import com.example.sectionfinder.util.similarity.scoring.SignatureScorer;
import com.example.sectionfinder.util.similarity.source.DocumentInfo;
import com.example.sectionfinder.util.similarity.source.PageFragmentSource;
import com.example.sectionfinder.util.similarity.source.ScaledViewportConverter;
import com.example.sectionfinder.util.similarity.source.ViewportConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 相似区段搜索器（版面后端）
 *
 * 流程：
 * 1. 选中文本去空白后不足 10 个字符，直接返回空结果（不调用任何提取）
 * 2. 以选区页为中心确定页窗口
 * 3. 分批提取每页片段（批内可并发），逐页报告进度
 * 4. 每页分组，汇总为窗口内全部分组
 * 5. 在选区页定位参考分组，找不到则返回空结果
 * 6. 遍历候选：跳过与参考同页且 IoU > 0.3 的分组（同一物理区段），打分并按阈值过滤
 * 7. 按得分降序排序并截断到 maxResults
 * 8. 把像素坐标换算回归一化坐标
 * 9. 报告最终进度
 *
 * 单页提取失败或缺少视口只跳过该页，不中断整个搜索
 */
public class SimilarSectionFinder implements SimilarityBackend {

    private static final Logger log = LoggerFactory.getLogger(SimilarSectionFinder.class);

    /** 选中文本最小长度（去首尾空白后） */
    public static final int MIN_TEXT_LENGTH = 10;

    /** 与参考分组同页且 IoU 超过该值视为同一区段 */
    public static final double SAME_SECTION_IOU = 0.3;

    /** 默认每批提取页数 */
    public static final int DEFAULT_BATCH_SIZE = 5;

    private final DocumentInfo documentInfo;
    private final PageFragmentSource fragmentSource;
    private final ViewportConverter converter;
    private final SectionGrouper grouper;
    private final SignatureScorer scorer;
    private final ReferenceLocator referenceLocator;
    private final GroupedPageCache pageCache;
    private final Executor extractionExecutor;
    private final int batchSize;

    public SimilarSectionFinder(DocumentInfo documentInfo, PageFragmentSource fragmentSource) {
        this(documentInfo, fragmentSource, new ScaledViewportConverter(), new SectionGrouper(),
                new SignatureScorer(), null, Runnable::run, DEFAULT_BATCH_SIZE);
    }

    /**
     * @param pageCache 页面分组缓存，可为 null（不缓存）
     * @param extractionExecutor 页面提取执行器；来源非线程安全时使用调用方线程执行（Runnable::run）
     * @param batchSize 每批并发提取的页数
     */
    public SimilarSectionFinder(DocumentInfo documentInfo,
                                PageFragmentSource fragmentSource,
                                ViewportConverter converter,
                                SectionGrouper grouper,
                                SignatureScorer scorer,
                                GroupedPageCache pageCache,
                                Executor extractionExecutor,
                                int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize 必须为正: " + batchSize);
        }
        this.documentInfo = documentInfo;
        this.fragmentSource = fragmentSource;
        this.converter = converter;
        this.grouper = grouper;
        this.scorer = scorer;
        this.referenceLocator = new ReferenceLocator(converter);
        this.pageCache = pageCache;
        this.extractionExecutor = extractionExecutor;
        this.batchSize = batchSize;
    }

    @Override
    public List<SimilarityResult> findSimilarSections(SearchOptions options) {
        options.validate();

        String selectedText = options.getSelectedText();
        if (selectedText == null || selectedText.trim().length() < MIN_TEXT_LENGTH) {
            log.info("选中文本过短，跳过相似搜索: length={}", selectedText == null ? 0 : selectedText.trim().length());
            return Collections.emptyList();
        }

        NormalizedPosition selectedPosition = options.getSelectedPosition();
        if (selectedPosition == null || selectedPosition.getBoundingRect() == null
                || !selectedPosition.getBoundingRect().hasDimensions()) {
            log.warn("选区位置不完整，跳过相似搜索: {}", selectedPosition);
            return Collections.emptyList();
        }

        int totalPages = documentInfo.getTotalPages();
        int currentPage = selectedPosition.getPageNumber();
        if (currentPage < 1 || currentPage > totalPages) {
            log.warn("选区页码超出文档范围: page={}, totalPages={}", currentPage, totalPages);
            return Collections.emptyList();
        }

        List<Integer> pagesToSearch = PageWindow.around(currentPage, totalPages, options.getMaxPages());
        ProgressListener progress = options.progress();

        log.info("开始相似搜索: text='{}', pages={}-{}, totalPages={}, threshold={}",
                abbreviate(selectedText, 50), pagesToSearch.get(0), pagesToSearch.get(pagesToSearch.size() - 1),
                totalPages, options.getThreshold());

        // ===== 提取 + 分组 =====
        Optional<Map<Integer, List<SectionGroup>>> extracted = extractAndGroup(pagesToSearch, progress);
        if (!extracted.isPresent()) {
            log.info("搜索线程被中断，放弃本次搜索");
            return Collections.emptyList();
        }

        List<SectionGroup> allGroups = new ArrayList<>();
        for (List<SectionGroup> groups : extracted.get().values()) {
            allGroups.addAll(groups);
        }
        log.debug("窗口内分组总数: {}", allGroups.size());

        // ===== 定位参考分组 =====
        Optional<PageViewport> viewport = documentInfo.viewportFor(currentPage);
        if (!viewport.isPresent()) {
            log.warn("选区页 {} 没有视口信息", currentPage);
            return Collections.emptyList();
        }

        Optional<SectionGroup> located = referenceLocator.locate(allGroups, currentPage, selectedPosition, viewport.get());
        if (!located.isPresent()) {
            return Collections.emptyList();
        }
        SectionGroup reference = located.get();
        progress.onProgress(pagesToSearch.size(), pagesToSearch.size(), 0);

        // ===== 打分 =====
        List<ScoredGroup> kept = new ArrayList<>();
        for (SectionGroup group : allGroups) {
            if (group.getPageNumber() == reference.getPageNumber()
                    && reference.getBounds().iou(group.getBounds()) > SAME_SECTION_IOU) {
                continue;
            }

            double score = scorer.score(reference, group);
            if (log.isDebugEnabled()) {
                log.debug("候选 page={} score={} text='{}'", group.getPageNumber(),
                        String.format("%.3f", score), abbreviate(group.getText(), 40));
            }
            if (score >= options.getThreshold()) {
                kept.add(new ScoredGroup(group, score));
            }
            progress.onProgress(pagesToSearch.size(), pagesToSearch.size(), kept.size());
        }

        kept.sort(Comparator.comparingDouble(ScoredGroup::getScore).reversed());
        if (kept.size() > options.getMaxResults()) {
            kept = new ArrayList<>(kept.subList(0, options.getMaxResults()));
        }

        // ===== 换算坐标 =====
        List<SimilarityResult> results = new ArrayList<>(kept.size());
        for (ScoredGroup scored : kept) {
            SectionGroup group = scored.getGroup();
            Optional<PageViewport> pageViewport = documentInfo.viewportFor(group.getPageNumber());
            if (!pageViewport.isPresent()) {
                log.warn("结果页 {} 没有视口信息，丢弃结果", group.getPageNumber());
                continue;
            }

            results.add(new SimilarityResult(group.getText(), scored.getScore(), toPosition(group, pageViewport.get())));
            progress.onProgress(pagesToSearch.size(), pagesToSearch.size(), results.size());
        }

        progress.onProgress(pagesToSearch.size(), pagesToSearch.size(), results.size());
        log.info("相似搜索完成: 参考='{}', 结果 {} 条", abbreviate(reference.getText(), 50), results.size());
        if (pageCache != null) {
            log.debug(pageCache.getStats());
        }
        return results;
    }

    /**
     * 分批提取并分组；线程被中断时返回空
     */
    private Optional<Map<Integer, List<SectionGroup>>> extractAndGroup(List<Integer> pages, ProgressListener progress) {
        Map<Integer, List<SectionGroup>> groupsByPage = new LinkedHashMap<>();
        int total = pages.size();
        int done = 0;

        for (int start = 0; start < total; start += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }

            List<Integer> batch = pages.subList(start, Math.min(start + batchSize, total));
            List<CompletableFuture<List<TextFragment>>> futures = new ArrayList<>(batch.size());
            for (Integer pageNumber : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> extractPage(pageNumber), extractionExecutor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (int i = 0; i < batch.size(); i++) {
                int pageNumber = batch.get(i);
                List<TextFragment> fragments = futures.get(i).join();
                groupsByPage.put(pageNumber, groupPage(pageNumber, fragments));
                progress.onProgress(++done, total, 0);
            }
        }

        return Optional.of(groupsByPage);
    }

    private List<TextFragment> extractPage(int pageNumber) {
        try {
            List<TextFragment> fragments = fragmentSource.getFragments(pageNumber);
            return fragments == null ? Collections.emptyList() : fragments;
        } catch (Exception e) {
            log.warn("页面 {} 提取失败，跳过: {}", pageNumber, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    /**
     * 分组失败（如来源返回了跨页片段）时跳过该页
     */
    private List<SectionGroup> groupPage(int pageNumber, List<TextFragment> fragments) {
        if (fragments.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            if (pageCache == null) {
                return grouper.groupFragments(fragments);
            }
            return pageCache.getOrCompute(PageFingerprint.of(pageNumber, fragments),
                    () -> grouper.groupFragments(fragments));
        } catch (RuntimeException e) {
            log.warn("页面 {} 分组失败，跳过: {}", pageNumber, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    private NormalizedPosition toPosition(SectionGroup group, PageViewport viewport) {
        int pageNumber = group.getPageNumber();
        NormalizedRect boundingRect = converter.toNormalized(group.getBounds(), viewport, pageNumber);

        List<NormalizedRect> rects = new ArrayList<>(group.getFragments().size());
        for (TextFragment fragment : group.getFragments()) {
            rects.add(converter.toNormalized(fragment.getBounds(), viewport, pageNumber));
        }

        return new NormalizedPosition(pageNumber, boundingRect, rects);
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * 带得分的候选分组
     */
    private static class ScoredGroup {
        private final SectionGroup group;
        private final double score;

        ScoredGroup(SectionGroup group, double score) {
            this.group = group;
            this.score = score;
        }

        SectionGroup getGroup() {
            return group;
        }

        double getScore() {
            return score;
        }
    }
}
