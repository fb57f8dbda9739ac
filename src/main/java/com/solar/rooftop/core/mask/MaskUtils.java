package com.solar.rooftop.core.mask;

import com.solar.rooftop.core.model.Polygon;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 二值掩码工具
 * <p>
 * 掩码统一使用 CV_8UC1，0 表示背景，255 表示前景。
 * 所有返回的新 Mat 由调用方负责释放。
 */
public final class MaskUtils {

    public static final int FOREGROUND = 255;

    private MaskUtils() {
    }

    /**
     * 转灰度图，单通道输入时返回副本
     */
    public static Mat toGray(Mat image) {
        Mat gray = new Mat();
        if (image.channels() == 3) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            image.copyTo(gray);
        }
        return gray;
    }

    /**
     * 与图像同尺寸的全零掩码
     */
    public static Mat emptyMask(int rows, int cols) {
        return Mat.zeros(rows, cols, CvType.CV_8UC1);
    }

    /**
     * 将多边形内部（含边界）填充为前景
     */
    public static Mat fillPolygon(int rows, int cols, Polygon polygon) {
        Mat mask = emptyMask(rows, cols);
        MatOfPoint contour = polygon.toMatOfPoint();
        try {
            Imgproc.drawContours(mask, Collections.singletonList(contour), -1, new Scalar(FOREGROUND), -1);
        } finally {
            contour.release();
        }
        return mask;
    }

    /**
     * 提取最外层轮廓
     */
    public static List<MatOfPoint> externalContours(Mat binary) {
        return findContours(binary, Imgproc.RETR_EXTERNAL, null);
    }

    /**
     * 提取轮廓；hierarchy 非空时按完整层级（RETR_TREE 等）输出层级信息
     */
    public static List<MatOfPoint> findContours(Mat binary, int mode, Mat hierarchy) {
        List<MatOfPoint> contours = new ArrayList<>();
        Mat work = binary.clone();
        Mat h = hierarchy != null ? hierarchy : new Mat();
        try {
            Imgproc.findContours(work, contours, h, mode, Imgproc.CHAIN_APPROX_SIMPLE);
        } finally {
            work.release();
            if (hierarchy == null) h.release();
        }
        return contours;
    }

    /**
     * 椭圆结构元素，尺寸至少为 1
     */
    public static Mat ellipseKernel(int size) {
        int s = Math.max(1, size);
        return Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(s, s));
    }

    public static int countForeground(Mat mask) {
        return Core.countNonZero(mask);
    }

    /**
     * 一次性读出单通道掩码的全部像素（1 次 JNI 调用）
     */
    public static byte[] toBytes(Mat mask) {
        Mat continuous = mask.isContinuous() ? mask : mask.clone();
        try {
            byte[] data = new byte[(int) continuous.total()];
            continuous.get(0, 0, data);
            return data;
        } finally {
            if (continuous != mask) continuous.release();
        }
    }

    public static void releaseAll(List<? extends Mat> mats) {
        if (mats == null) return;
        for (Mat m : mats) {
            if (m != null) m.release();
        }
    }

    public static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) m.release();
        }
    }
}
