package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import com.example.sectionfinder.util.similarity.source.DocumentInfo;
import com.example.sectionfinder.util.similarity.source.PageFragmentSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存文档：固定视口 600x800，可指定提取失败页和缺视口页
 */
public class InMemoryDocument implements PageFragmentSource, DocumentInfo {

    public static final PageViewport VIEWPORT = new PageViewport(600, 800);

    private final int totalPages;
    private final Map<Integer, List<TextFragment>> pages = new ConcurrentHashMap<>();
    private final Set<Integer> failingPages = ConcurrentHashMap.newKeySet();
    private final Set<Integer> pagesWithoutViewport = ConcurrentHashMap.newKeySet();
    private final AtomicInteger extractions = new AtomicInteger();

    public InMemoryDocument(int totalPages) {
        this.totalPages = totalPages;
    }

    public InMemoryDocument add(TextFragment fragment) {
        pages.computeIfAbsent(fragment.getPageNumber(), p -> Collections.synchronizedList(new ArrayList<>()))
                .add(fragment);
        return this;
    }

    public InMemoryDocument failOn(int pageNumber) {
        failingPages.add(pageNumber);
        return this;
    }

    public InMemoryDocument withoutViewport(int pageNumber) {
        pagesWithoutViewport.add(pageNumber);
        return this;
    }

    public int getExtractions() {
        return extractions.get();
    }

    @Override
    public List<TextFragment> getFragments(int pageNumber) throws IOException {
        extractions.incrementAndGet();
        if (failingPages.contains(pageNumber)) {
            throw new IOException("broken page " + pageNumber);
        }
        return new ArrayList<>(pages.getOrDefault(pageNumber, Collections.emptyList()));
    }

    @Override
    public int getTotalPages() {
        return totalPages;
    }

    @Override
    public java.util.Optional<PageViewport> viewportFor(int pageNumber) {
        if (pageNumber < 1 || pageNumber > totalPages || pagesWithoutViewport.contains(pageNumber)) {
            return java.util.Optional.empty();
        }
        return java.util.Optional.of(VIEWPORT);
    }
}
