package com.solar.rooftop.core.energy;

import com.solar.rooftop.core.mask.MaskUtils;
import com.solar.rooftop.core.model.RoofCharacteristics;
import com.solar.rooftop.core.model.Rooftop;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;

/**
 * 屋顶外观特征估计
 * <p>
 * 基于亮度的启发式：
 * - 类型：纹理标准差 + 边缘密度
 * - 坡度：屋顶内亮度极差映射到 0-45°
 * - 遮挡：屋顶与周边亮度之比，按暗像素占比折减
 * - 方位角：由外接矩形角度换算（图像上方为北）
 * 屋顶为空时返回中性默认值（unknown / 0° / 0.5）。
 */
public class RoofCharacteristicsAnalyzer {

    public static final String TYPE_FLAT = "flat";
    public static final String TYPE_GABLED = "gabled";
    public static final String TYPE_HIPPED = "hipped";
    public static final String TYPE_COMPLEX = "complex";
    public static final String TYPE_UNKNOWN = "unknown";

    static final double NEUTRAL_SHADING = 0.5;
    static final double NEUTRAL_SLOPE = 0.0;

    private static final double FLAT_MAX_STD = 20;
    private static final double FLAT_MAX_EDGE_DENSITY = 0.05;
    private static final double COMPLEX_MIN_EDGE_DENSITY = 0.15;
    private static final double GABLED_MIN_STD = 30;
    private static final double CANNY_LOW = 50;
    private static final double CANNY_HIGH = 150;
    private static final int SURROUNDING_KERNEL = 50;
    private static final double SHADOW_PERCENTILE = 25;

    public RoofCharacteristics analyze(Mat image, Mat roofMask, Rooftop rooftop) {
        double azimuth = azimuth(rooftop.getAngle());

        Mat gray = MaskUtils.toGray(image);
        try {
            int roofPixels = Core.countNonZero(roofMask);
            if (roofPixels == 0) {
                return RoofCharacteristics.builder()
                        .roofType(TYPE_UNKNOWN)
                        .slopeDegrees(NEUTRAL_SLOPE)
                        .shadingScore(NEUTRAL_SHADING)
                        .azimuthDegrees(azimuth)
                        .build();
            }

            return RoofCharacteristics.builder()
                    .roofType(classifyRoofType(gray, roofMask, roofPixels))
                    .slopeDegrees(round(estimateSlope(gray, roofMask), 2))
                    .shadingScore(round(shadingScore(gray, roofMask), 3))
                    .azimuthDegrees(round(azimuth, 2))
                    .build();
        } finally {
            gray.release();
        }
    }

    /**
     * 方位角：0=北 90=东 180=南 270=西
     */
    public static double azimuth(double rectAngle) {
        double a = (90 - rectAngle) % 360;
        return a < 0 ? a + 360 : a;
    }

    String classifyRoofType(Mat gray, Mat roofMask, int roofPixels) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        Mat masked = new Mat();
        Mat edges = new Mat();
        try {
            Core.meanStdDev(gray, mean, std, roofMask);
            double stdDev = std.toArray()[0];

            gray.copyTo(masked, roofMask);
            Imgproc.Canny(masked, edges, CANNY_LOW, CANNY_HIGH);
            double edgeDensity = (double) Core.countNonZero(edges) / roofPixels;

            if (stdDev < FLAT_MAX_STD && edgeDensity < FLAT_MAX_EDGE_DENSITY) {
                return TYPE_FLAT;
            } else if (edgeDensity > COMPLEX_MIN_EDGE_DENSITY) {
                return TYPE_COMPLEX;
            } else if (stdDev > GABLED_MIN_STD) {
                return TYPE_GABLED;
            }
            return TYPE_HIPPED;
        } finally {
            MaskUtils.release(mean, std, masked, edges);
        }
    }

    /**
     * 亮度极差 r：r<30 → r/3；r<60 → 10+(r-30)/1.5；否则 min(45, 30+(r-60)/4)
     */
    double estimateSlope(Mat gray, Mat roofMask) {
        Core.MinMaxLocResult mm = Core.minMaxLoc(gray, roofMask);
        return slopeFromRange(mm.maxVal - mm.minVal);
    }

    static double slopeFromRange(double range) {
        if (range < 30) {
            return range / 3;
        } else if (range < 60) {
            return 10 + (range - 30) / 1.5;
        }
        return Math.min(45, 30 + (range - 60) / 4);
    }

    double shadingScore(Mat gray, Mat roofMask) {
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(SURROUNDING_KERNEL, SURROUNDING_KERNEL));
        Mat surrounding = new Mat();
        try {
            Imgproc.dilate(roofMask, surrounding, kernel);
            double roofMean = Core.mean(gray, roofMask).val[0];
            double surroundingMean = Core.mean(gray, surrounding).val[0];

            int[] histogram = histogram(gray, roofMask);
            double threshold = percentile(histogram, SHADOW_PERCENTILE);
            long total = 0;
            long below = 0;
            for (int v = 0; v < histogram.length; v++) {
                total += histogram[v];
                if (v < threshold) below += histogram[v];
            }
            if (total == 0) return NEUTRAL_SHADING;

            double shadowRatio = (double) below / total;
            double brightnessRatio = roofMean / (surroundingMean + 1e-6);
            double score = brightnessRatio * (1 - shadowRatio * 0.5);
            return Math.max(0, Math.min(1, score));
        } finally {
            kernel.release();
            surrounding.release();
        }
    }

    /**
     * 掩码内灰度直方图
     */
    static int[] histogram(Mat gray, Mat mask) {
        byte[] pixels = MaskUtils.toBytes(gray);
        byte[] m = MaskUtils.toBytes(mask);
        int[] histogram = new int[256];
        for (int i = 0; i < pixels.length; i++) {
            if (m[i] != 0) histogram[pixels[i] & 0xFF]++;
        }
        return histogram;
    }

    /**
     * 线性插值百分位（与 numpy 默认方式一致）
     */
    static double percentile(int[] histogram, double p) {
        long n = 0;
        for (int c : histogram) n += c;
        if (n == 0) return 0;

        double rank = p / 100.0 * (n - 1);
        long lower = (long) Math.floor(rank);
        long upper = (long) Math.ceil(rank);
        double lowerValue = valueAtRank(histogram, lower);
        double upperValue = valueAtRank(histogram, upper);
        return lowerValue + (upperValue - lowerValue) * (rank - lower);
    }

    private static int valueAtRank(int[] histogram, long rank) {
        long seen = 0;
        for (int v = 0; v < histogram.length; v++) {
            seen += histogram[v];
            if (seen > rank) return v;
        }
        return histogram.length - 1;
    }

    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
