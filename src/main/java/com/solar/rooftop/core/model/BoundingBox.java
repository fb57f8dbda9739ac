package com.solar.rooftop.core.model;

/**
 * 轴对齐整数边界框，用于多尺度检测结果的去重
 */
public class BoundingBox {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public BoundingBox(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() { return x; }
    public int getY() { return y; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public long area() {
        return (long) width * height;
    }

    /**
     * 与另一个框的交集面积，不相交时为 0
     */
    public long intersectionArea(BoundingBox other) {
        int x1 = Math.max(x, other.x);
        int y1 = Math.max(y, other.y);
        int x2 = Math.min(x + width, other.x + other.width);
        int y2 = Math.min(y + height, other.y + other.height);
        long w = Math.max(0, x2 - x1);
        long h = Math.max(0, y2 - y1);
        return w * h;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[%d,%d %dx%d]", x, y, width, height);
    }
}
