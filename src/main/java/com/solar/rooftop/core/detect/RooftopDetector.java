package com.solar.rooftop.core.detect;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.InvalidInputException;
import com.solar.rooftop.core.mask.MaskUtils;
import com.solar.rooftop.core.model.OrientedRect;
import com.solar.rooftop.core.model.Point;
import com.solar.rooftop.core.model.Polygon;
import com.solar.rooftop.core.model.Rooftop;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import org.opencv.imgproc.Moments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 屋顶检测器
 * <p>
 * 支持两种输入：
 * 1. 预分割掩码（暗背景上的白色屋顶）：直接阈值化提取外轮廓
 * 2. 原始卫星图：双边滤波后在多个尺度上做 Canny 边缘 + 轮廓提取，
 *    轮廓还原到原图尺寸后按面积过滤，再做边界框非极大值抑制
 * <p>
 * 对同一图像与配置，输出确定。未检测到屋顶时返回空列表。
 */
public class RooftopDetector {
    private static final Logger logger = LoggerFactory.getLogger(RooftopDetector.class);

    /**
     * 输入类型
     */
    public enum DetectionMode {
        PRE_SEGMENTED,  // 预分割掩码
        RAW_IMAGERY     // 原始影像
    }

    private final AnalysisConfig config;
    private final BoxSuppressor suppressor;

    public RooftopDetector(AnalysisConfig config) {
        this.config = config;
        this.suppressor = new BoxSuppressor(config.getOverlapThreshold());
    }

    /**
     * 检测图像中的所有屋顶
     *
     * @param image BGR 或灰度 8 位图像（调用方负责释放）
     * @return 屋顶列表，id 从 1 开始按检测顺序编号
     */
    public List<Rooftop> detect(Mat image) {
        if (image == null || image.empty()) {
            throw new InvalidInputException("Input image is null or empty");
        }
        if (image.depth() != CvType.CV_8U) {
            throw new InvalidInputException("Input image must be 8-bit, got depth " + image.depth());
        }

        Mat gray = MaskUtils.toGray(image);
        try {
            DetectionMode mode = detectMode(gray);
            List<Polygon> boundaries = mode == DetectionMode.PRE_SEGMENTED
                    ? extractFromMask(gray)
                    : extractFromImagery(gray);
            logger.info("Rooftop detection: mode={}, boundaries={}", mode, boundaries.size());

            List<Rooftop> rooftops = new ArrayList<>(boundaries.size());
            for (int i = 0; i < boundaries.size(); i++) {
                rooftops.add(buildRooftop(i + 1, boundaries.get(i)));
            }
            return rooftops;
        } finally {
            gray.release();
        }
    }

    /**
     * 根据亮像素占比判断输入类型：占比严格位于 (min, max) 之间视为预分割掩码
     */
    public DetectionMode detectMode(Mat gray) {
        double fraction = brightFraction(gray);
        logger.debug("Bright pixel fraction: {}", String.format("%.4f", fraction));
        return fraction > config.getMaskFractionMin() && fraction < config.getMaskFractionMax()
                ? DetectionMode.PRE_SEGMENTED
                : DetectionMode.RAW_IMAGERY;
    }

    double brightFraction(Mat gray) {
        Mat bright = new Mat();
        try {
            Imgproc.threshold(gray, bright, config.getBrightPixelThreshold(), 255, Imgproc.THRESH_BINARY);
            return (double) Core.countNonZero(bright) / gray.total();
        } finally {
            bright.release();
        }
    }

    /**
     * 预分割掩码：中值阈值二值化，保留面积超过下限的外轮廓
     */
    List<Polygon> extractFromMask(Mat gray) {
        Mat binary = new Mat();
        List<MatOfPoint> contours = null;
        try {
            Imgproc.threshold(gray, binary, config.getBinarizeThreshold(), 255, Imgproc.THRESH_BINARY);
            contours = MaskUtils.externalContours(binary);

            List<Polygon> result = new ArrayList<>();
            for (MatOfPoint cnt : contours) {
                if (Imgproc.contourArea(cnt) > config.getMinMaskAreaPx()) {
                    result.add(Polygon.fromMat(cnt));
                }
            }
            return result;
        } finally {
            binary.release();
            MaskUtils.releaseAll(contours);
        }
    }

    /**
     * 原始影像：多尺度边缘检测，轮廓还原到原图后按面积过滤并去重
     */
    List<Polygon> extractFromImagery(Mat gray) {
        Mat blur = new Mat();
        try {
            Imgproc.bilateralFilter(gray, blur, config.getBilateralDiameter(),
                    config.getBilateralSigmaColor(), config.getBilateralSigmaSpace());

            List<Polygon> candidates = new ArrayList<>();
            for (double scale : config.getDetectionScales()) {
                List<Polygon> found = detectAtScale(blur, scale);
                logger.debug("Scale {}: {} candidate boundaries", scale, found.size());
                candidates.addAll(found);
            }

            List<Polygon> kept = suppressor.suppress(candidates);
            logger.debug("Non-max suppression: {} -> {}", candidates.size(), kept.size());
            return kept;
        } finally {
            blur.release();
        }
    }

    private List<Polygon> detectAtScale(Mat blur, double scale) {
        Mat resized = new Mat();
        Mat edges = new Mat();
        List<MatOfPoint> contours = null;
        try {
            int w = (int) (blur.cols() * scale);
            int h = (int) (blur.rows() * scale);
            if (w <= 0 || h <= 0) {
                return new ArrayList<>();
            }
            Imgproc.resize(blur, resized, new Size(w, h));
            Imgproc.Canny(resized, edges, config.getCannyLow(), config.getCannyHigh());
            contours = MaskUtils.externalContours(edges);

            List<Polygon> result = new ArrayList<>();
            for (MatOfPoint cnt : contours) {
                Polygon restored = Polygon.fromMat(cnt).divide(scale);
                double area = restored.area();
                if (area > config.getMinBuildingAreaPx() && area < config.getMaxBuildingAreaPx()) {
                    result.add(restored);
                }
            }
            return result;
        } finally {
            resized.release();
            edges.release();
            MaskUtils.releaseAll(contours);
        }
    }

    /**
     * 计算单个轮廓的几何指标
     */
    Rooftop buildRooftop(int id, Polygon boundary) {
        MatOfPoint contour = boundary.toMatOfPoint();
        MatOfPoint2f contour2f = boundary.toMatOfPoint2f();
        try {
            double areaPixels = Imgproc.contourArea(contour);
            double scale = config.getPixelToMeter();
            double areaM2 = areaPixels * scale * scale;

            OrientedRect rect = OrientedRect.of(Imgproc.minAreaRect(contour2f));

            // 一阶矩求质心，零面积时退回到外接矩形中心
            Moments m = Imgproc.moments(contour);
            Point centroid;
            if (m.m00 != 0) {
                centroid = new Point((int) (m.m10 / m.m00), (int) (m.m01 / m.m00));
            } else {
                centroid = new Point((int) rect.getCenter().x, (int) rect.getCenter().y);
            }

            return new Rooftop(id, boundary, areaPixels, areaM2, centroid, rect);
        } finally {
            contour.release();
            contour2f.release();
        }
    }
}
