package com.solar.rooftop.core.model;

import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;

/**
 * 由轮廓追踪得到的闭合多边形，顶点为整数像素坐标，创建后不可变
 */
public final class Polygon {
    private final int[] xs;
    private final int[] ys;

    public Polygon(int[] xs, int[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: " + xs.length + " vs " + ys.length);
        }
        this.xs = xs.clone();
        this.ys = ys.clone();
    }

    public static Polygon fromMat(MatOfPoint contour) {
        org.opencv.core.Point[] pts = contour.toArray();
        int[] xs = new int[pts.length];
        int[] ys = new int[pts.length];
        for (int i = 0; i < pts.length; i++) {
            xs[i] = (int) pts[i].x;
            ys[i] = (int) pts[i].y;
        }
        return new Polygon(xs, ys);
    }

    /**
     * 轴对齐矩形多边形（顺时针，左上角起）
     */
    public static Polygon rectangle(int x, int y, int width, int height) {
        return new Polygon(
                new int[]{x, x + width, x + width, x},
                new int[]{y, y, y + height, y + height});
    }

    public int size() {
        return xs.length;
    }

    public int getX(int i) {
        return xs[i];
    }

    public int getY(int i) {
        return ys[i];
    }

    /**
     * 坐标除以 factor 后截断取整，用于把缩放图上的轮廓还原到原图
     */
    public Polygon divide(double factor) {
        int[] nx = new int[xs.length];
        int[] ny = new int[ys.length];
        for (int i = 0; i < xs.length; i++) {
            nx[i] = (int) (xs[i] / factor);
            ny[i] = (int) (ys[i] / factor);
        }
        return new Polygon(nx, ny);
    }

    public MatOfPoint toMatOfPoint() {
        org.opencv.core.Point[] pts = new org.opencv.core.Point[xs.length];
        for (int i = 0; i < xs.length; i++) {
            pts[i] = new org.opencv.core.Point(xs[i], ys[i]);
        }
        return new MatOfPoint(pts);
    }

    public MatOfPoint2f toMatOfPoint2f() {
        org.opencv.core.Point[] pts = new org.opencv.core.Point[xs.length];
        for (int i = 0; i < xs.length; i++) {
            pts[i] = new org.opencv.core.Point(xs[i], ys[i]);
        }
        return new MatOfPoint2f(pts);
    }

    /**
     * 轮廓面积（像素），与 OpenCV contourArea 一致
     */
    public double area() {
        MatOfPoint mat = toMatOfPoint();
        try {
            return Imgproc.contourArea(mat);
        } finally {
            mat.release();
        }
    }

    public BoundingBox boundingBox() {
        MatOfPoint mat = toMatOfPoint();
        try {
            Rect r = Imgproc.boundingRect(mat);
            return new BoundingBox(r.x, r.y, r.width, r.height);
        } finally {
            mat.release();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polygon)) return false;
        Polygon other = (Polygon) o;
        return Arrays.equals(xs, other.xs) && Arrays.equals(ys, other.ys);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(xs) + Arrays.hashCode(ys);
    }

    @Override
    public String toString() {
        return "Polygon[" + xs.length + " vertices]";
    }
}
