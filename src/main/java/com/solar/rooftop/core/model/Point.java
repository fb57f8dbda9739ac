package com.solar.rooftop.core.model;

/**
 * 二维点（像素坐标）
 */
public class Point {
    public double x;
    public double y;

    public Point() {
    }

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * 绕 pivot 旋转 angleDegrees 度（图像坐标系，标准二维旋转矩阵）
     */
    public Point rotateAround(Point pivot, double angleDegrees) {
        double rad = Math.toRadians(angleDegrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        double dx = x - pivot.x;
        double dy = y - pivot.y;
        return new Point(pivot.x + dx * cos - dy * sin, pivot.y + dx * sin + dy * cos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point other = (Point) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
