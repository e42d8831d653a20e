package com.example.sectionfinder.util.similarity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 归一化矩形（与分辨率无关）
 *
 * x1/y1/x2/y2 是在参考尺寸 width × height 下记录的坐标，
 * 换算到任意视口：pixel = viewportSize * value / referenceSize
 */
public final class NormalizedRect {

    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;
    private final double width;
    private final double height;
    private final int pageNumber;

    @JsonCreator
    public NormalizedRect(@JsonProperty("x1") double x1,
                          @JsonProperty("y1") double y1,
                          @JsonProperty("x2") double x2,
                          @JsonProperty("y2") double y2,
                          @JsonProperty("width") double width,
                          @JsonProperty("height") double height,
                          @JsonProperty("pageNumber") int pageNumber) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
        this.width = width;
        this.height = height;
        this.pageNumber = pageNumber;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double getX2() {
        return x2;
    }

    public double getY2() {
        return y2;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    /**
     * 参考尺寸缺失或为 0 时无法换算
     */
    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }

    @Override
    public String toString() {
        return String.format("NormalizedRect{page=%d, x1=%.2f, y1=%.2f, x2=%.2f, y2=%.2f, ref=%.1fx%.1f}",
                pageNumber, x1, y1, x2, y2, width, height);
    }
}
