package com.example.sectionfinder.util.similarity.dto;

import java.util.Collection;

/**
 * 像素空间矩形（left/top/width/height）
 *
 * 坐标系：左上角为原点，y 轴向下（与渲染后的页面视口一致）
 */
public final class Rect {

    public static final Rect EMPTY = new Rect(0, 0, 0, 0);

    private final double left;
    private final double top;
    private final double width;
    private final double height;

    public Rect(double left, double top, double width, double height) {
        this.left = left;
        this.top = top;
        this.width = width;
        this.height = height;
    }

    /**
     * 由左上、右下两点构造
     */
    public static Rect fromEdges(double left, double top, double right, double bottom) {
        return new Rect(left, top, right - left, bottom - top);
    }

    public double getLeft() {
        return left;
    }

    public double getTop() {
        return top;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double right() {
        return left + width;
    }

    public double bottom() {
        return top + height;
    }

    public double area() {
        return width * height;
    }

    /**
     * 两个矩形的最小外接矩形
     */
    public Rect union(Rect other) {
        return fromEdges(
                Math.min(left, other.left),
                Math.min(top, other.top),
                Math.max(right(), other.right()),
                Math.max(bottom(), other.bottom()));
    }

    /**
     * 一组矩形的最小外接矩形，空集合返回 {@link #EMPTY}
     */
    public static Rect unionOf(Collection<Rect> rects) {
        if (rects == null || rects.isEmpty()) {
            return EMPTY;
        }

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (Rect r : rects) {
            minX = Math.min(minX, r.left);
            minY = Math.min(minY, r.top);
            maxX = Math.max(maxX, r.right());
            maxY = Math.max(maxY, r.bottom());
        }

        return fromEdges(minX, minY, maxX, maxY);
    }

    /**
     * 重叠面积（无重叠为 0）
     */
    public double intersectionArea(Rect other) {
        double overlapX = Math.max(0, Math.min(right(), other.right()) - Math.max(left, other.left));
        double overlapY = Math.max(0, Math.min(bottom(), other.bottom()) - Math.max(top, other.top));
        return overlapX * overlapY;
    }

    /**
     * Intersection-over-Union，范围 [0, 1]；并集面积为 0 时返回 0
     */
    public double iou(Rect other) {
        double overlap = intersectionArea(other);
        double unionArea = area() + other.area() - overlap;
        return unionArea > 0 ? overlap / unionArea : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rect)) return false;
        Rect rect = (Rect) o;
        return Double.compare(rect.left, left) == 0
                && Double.compare(rect.top, top) == 0
                && Double.compare(rect.width, width) == 0
                && Double.compare(rect.height, height) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(left);
        result = 31 * result + Double.hashCode(top);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Rect{left=%.2f, top=%.2f, width=%.2f, height=%.2f}", left, top, width, height);
    }
}
