package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.SimilarityResult;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import com.example.sectionfinder.util.similarity.dto.TextMatch;
import com.example.sectionfinder.util.similarity.source.DocumentInfo;
import com.example.sectionfinder.util.similarity.source.PageFragmentSource;
import com.example.sectionfinder.util.similarity.source.ViewportConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 文本相似搜索器（文本后端）
 *
 * 与版面后端共用页窗口和协作者，但只比较文字：
 * 每页片段拼成语料，用 {@link NgramTextMatcher} 找相似窗口，
 * 再把命中的词映射回片段，得到结果位置
 */
public class NgramSectionFinder implements SimilarityBackend {

    private static final Logger log = LoggerFactory.getLogger(NgramSectionFinder.class);

    private final DocumentInfo documentInfo;
    private final PageFragmentSource fragmentSource;
    private final ViewportConverter converter;
    private final NgramTextMatcher matcher;

    public NgramSectionFinder(DocumentInfo documentInfo, PageFragmentSource fragmentSource,
                              ViewportConverter converter) {
        this(documentInfo, fragmentSource, converter, new NgramTextMatcher());
    }

    public NgramSectionFinder(DocumentInfo documentInfo, PageFragmentSource fragmentSource,
                              ViewportConverter converter, NgramTextMatcher matcher) {
        this.documentInfo = documentInfo;
        this.fragmentSource = fragmentSource;
        this.converter = converter;
        this.matcher = matcher;
    }

    @Override
    public List<SimilarityResult> findSimilarSections(SearchOptions options) {
        options.validate();

        String selectedText = options.getSelectedText();
        NormalizedPosition selectedPosition = options.getSelectedPosition();
        if (selectedText == null || selectedText.trim().length() < SimilarSectionFinder.MIN_TEXT_LENGTH) {
            return Collections.emptyList();
        }
        if (selectedPosition == null || selectedPosition.getBoundingRect() == null
                || !selectedPosition.getBoundingRect().hasDimensions()) {
            log.warn("选区位置不完整，跳过文本相似搜索: {}", selectedPosition);
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
        Rect selectionRect = selectionPixels(selectedPosition);

        log.info("开始文本相似搜索: pages={}-{}, threshold={}", pagesToSearch.get(0),
                pagesToSearch.get(pagesToSearch.size() - 1), options.getThreshold());

        List<SimilarityResult> results = new ArrayList<>();
        int done = 0;
        for (int pageNumber : pagesToSearch) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("搜索线程被中断，放弃本次搜索");
                return Collections.emptyList();
            }

            results.addAll(searchPage(pageNumber, selectedText, options.getThreshold(),
                    pageNumber == currentPage ? selectionRect : null));
            progress.onProgress(++done, pagesToSearch.size(), results.size());
        }

        results.sort(Comparator.comparingDouble(SimilarityResult::getScore).reversed());
        if (results.size() > options.getMaxResults()) {
            results = new ArrayList<>(results.subList(0, options.getMaxResults()));
        }

        progress.onProgress(pagesToSearch.size(), pagesToSearch.size(), results.size());
        log.info("文本相似搜索完成: 结果 {} 条", results.size());
        return results;
    }

    private List<SimilarityResult> searchPage(int pageNumber, String selectedText, double threshold, Rect selfRect) {
        List<TextFragment> fragments;
        try {
            fragments = fragmentSource.getFragments(pageNumber);
        } catch (Exception e) {
            log.warn("页面 {} 提取失败，跳过: {}", pageNumber, e.getMessage(), e);
            return Collections.emptyList();
        }

        Optional<PageViewport> viewport = documentInfo.viewportFor(pageNumber);
        if (fragments == null || fragments.isEmpty() || !viewport.isPresent()) {
            return Collections.emptyList();
        }

        // 每个语料词对应的片段下标
        List<Integer> wordOwners = new ArrayList<>();
        StringBuilder corpus = new StringBuilder();
        for (int i = 0; i < fragments.size(); i++) {
            TextFragment fragment = fragments.get(i);
            for (String word : TextUtils.words(fragment.getText())) {
                wordOwners.add(i);
                corpus.append(word).append(' ');
            }
        }

        List<SimilarityResult> pageResults = new ArrayList<>();
        for (TextMatch match : matcher.findSimilarText(selectedText, corpus.toString(), threshold)) {
            List<TextFragment> matched = fragmentsOf(match, fragments, wordOwners);
            Rect bounds = Rect.unionOf(boundsOf(matched));

            if (selfRect != null && selfRect.iou(bounds) > SimilarSectionFinder.SAME_SECTION_IOU) {
                log.debug("跳过选区自身: page={}, text='{}'", pageNumber, match.getText());
                continue;
            }

            List<NormalizedRect> rects = new ArrayList<>(matched.size());
            for (TextFragment fragment : matched) {
                rects.add(converter.toNormalized(fragment.getBounds(), viewport.get(), pageNumber));
            }
            NormalizedPosition position = new NormalizedPosition(pageNumber,
                    converter.toNormalized(bounds, viewport.get(), pageNumber), rects);
            pageResults.add(new SimilarityResult(joinTexts(matched), match.getScore(), position));
        }
        return pageResults;
    }

    private Rect selectionPixels(NormalizedPosition selectedPosition) {
        NormalizedRect boundingRect = selectedPosition.getBoundingRect();
        Optional<PageViewport> viewport = documentInfo.viewportFor(selectedPosition.getPageNumber());
        return viewport.map(v -> converter.toPixels(boundingRect, v)).orElse(null);
    }

    private static List<TextFragment> fragmentsOf(TextMatch match, List<TextFragment> fragments, List<Integer> wordOwners) {
        List<TextFragment> matched = new ArrayList<>();
        int last = -1;
        for (int w = match.getStartWordIndex(); w < match.getEndWordIndex(); w++) {
            int owner = wordOwners.get(w);
            if (owner != last) {
                matched.add(fragments.get(owner));
                last = owner;
            }
        }
        return matched;
    }

    private static List<Rect> boundsOf(List<TextFragment> fragments) {
        List<Rect> rects = new ArrayList<>(fragments.size());
        for (TextFragment fragment : fragments) {
            rects.add(fragment.getBounds());
        }
        return rects;
    }

    private static String joinTexts(List<TextFragment> fragments) {
        StringBuilder sb = new StringBuilder();
        for (TextFragment fragment : fragments) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(fragment.getText().trim());
        }
        return sb.toString();
    }
}
