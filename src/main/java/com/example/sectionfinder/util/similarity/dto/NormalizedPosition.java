package com.example.sectionfinder.util.similarity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 页内归一化位置：外接矩形 + 组成矩形（多行选区时有多个）
 */
public final class NormalizedPosition {

    private final int pageNumber;
    private final NormalizedRect boundingRect;
    private final List<NormalizedRect> rects;

    @JsonCreator
    public NormalizedPosition(@JsonProperty("pageNumber") int pageNumber,
                              @JsonProperty("boundingRect") NormalizedRect boundingRect,
                              @JsonProperty("rects") List<NormalizedRect> rects) {
        this.pageNumber = pageNumber;
        this.boundingRect = boundingRect;
        this.rects = rects == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(rects));
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public NormalizedRect getBoundingRect() {
        return boundingRect;
    }

    public List<NormalizedRect> getRects() {
        return rects;
    }

    @Override
    public String toString() {
        return "NormalizedPosition{page=" + pageNumber + ", boundingRect=" + boundingRect
                + ", rects=" + rects.size() + "}";
    }
}
