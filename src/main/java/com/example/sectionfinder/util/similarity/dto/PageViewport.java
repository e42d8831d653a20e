package com.example.sectionfinder.util.similarity.dto;

/**
 * 页面视口尺寸（像素）
 */
public final class PageViewport {

    private final double width;
    private final double height;

    public PageViewport(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return String.format("PageViewport{%.1fx%.1f}", width, height);
    }
}
