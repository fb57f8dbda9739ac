package com.solar.rooftop.core.detect;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.mask.MaskUtils;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 屋顶障碍物检测（烟囱、通风口、空调、天窗等）
 * <p>
 * 只在屋顶掩码内统计灰度均值与标准差，三种检测取并集：
 * 1. 明显偏暗的像素（阴影 / 烟囱）
 * 2. 明显偏亮的像素（天窗 / 反光设备）
 * 3. 屋顶掩码内部的小轮廓（结构孔洞）
 * 屋顶灰度均匀（标准差不超过 uniformRoofMaxStd）时没有可区分的像素，只做第 3 种检测。
 * 之后开运算去噪、膨胀留出安全边距。
 */
public class ObstacleDetector {
    private static final Logger logger = LoggerFactory.getLogger(ObstacleDetector.class);

    private final AnalysisConfig config;

    public ObstacleDetector(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * @param image    源图像（BGR 或灰度）
     * @param roofMask 屋顶掩码（CV_8UC1）
     * @return 障碍物掩码，与图像同尺寸，调用方负责释放
     */
    public Mat detect(Mat image, Mat roofMask) {
        Mat gray = MaskUtils.toGray(image);
        Mat dark = new Mat();
        Mat bright = new Mat();
        Mat internal = null;
        Mat kernelOpen = null;
        Mat kernelDilate = null;
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        try {
            if (Core.countNonZero(roofMask) == 0) {
                return MaskUtils.emptyMask(gray.rows(), gray.cols());
            }

            // 屋顶内的灰度统计（总体标准差）
            Core.meanStdDev(gray, mean, std, roofMask);
            double mu = mean.toArray()[0];
            double sigma = std.toArray()[0];

            double k = config.getObstacleStdMultiplier();
            double darkThreshold = Math.max(config.getDarkFloor(), mu - k * sigma);
            double brightThreshold = Math.min(config.getBrightCeiling(), mu + k * sigma);
            logger.debug("Roof intensity mean={}, std={}, dark<{}, bright>{}",
                    String.format("%.2f", mu), String.format("%.2f", sigma),
                    String.format("%.2f", darkThreshold), String.format("%.2f", brightThreshold));

            if (sigma <= config.getUniformRoofMaxStd()) {
                dark.release();
                bright.release();
                dark = MaskUtils.emptyMask(gray.rows(), gray.cols());
                bright = MaskUtils.emptyMask(gray.rows(), gray.cols());
            } else {
                // 方法1：偏暗像素
                Core.compare(gray, new Scalar(darkThreshold), dark, Core.CMP_LT);
                Core.bitwise_and(dark, roofMask, dark);

                // 方法2：偏亮像素
                Core.compare(gray, new Scalar(brightThreshold), bright, Core.CMP_GT);
                Core.bitwise_and(bright, roofMask, bright);
            }

            // 方法3：内部小轮廓
            internal = internalFeatures(roofMask);

            Mat obstacles = new Mat();
            Core.bitwise_or(dark, bright, obstacles);
            Core.bitwise_or(obstacles, internal, obstacles);

            // 开运算去除孤立噪点，再膨胀留出安全边距
            kernelOpen = MaskUtils.ellipseKernel(config.getOpenKernelSize());
            Imgproc.morphologyEx(obstacles, obstacles, Imgproc.MORPH_OPEN, kernelOpen);
            kernelDilate = MaskUtils.ellipseKernel(config.getDilateKernelSize());
            Imgproc.dilate(obstacles, obstacles, kernelDilate);

            return obstacles;
        } finally {
            MaskUtils.release(gray, dark, bright, internal, kernelOpen, kernelDilate, mean, std);
        }
    }

    /**
     * 屋顶掩码内部（有父轮廓）且面积在 (min, max) 之间的轮廓，填充后返回
     */
    Mat internalFeatures(Mat roofMask) {
        Mat internal = MaskUtils.emptyMask(roofMask.rows(), roofMask.cols());
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = null;
        try {
            contours = MaskUtils.findContours(roofMask, Imgproc.RETR_TREE, hierarchy);
            if (hierarchy.empty()) {
                return internal;
            }

            List<MatOfPoint> selected = new ArrayList<>();
            for (int i = 0; i < contours.size(); i++) {
                // hierarchy: [next, previous, firstChild, parent]
                double[] h = hierarchy.get(0, i);
                if (h[3] < 0) continue;

                double area = Imgproc.contourArea(contours.get(i));
                if (area > config.getInternalMinAreaPx() && area < config.getInternalMaxAreaPx()) {
                    selected.add(contours.get(i));
                }
            }
            if (!selected.isEmpty()) {
                Imgproc.drawContours(internal, selected, -1, new Scalar(MaskUtils.FOREGROUND), -1);
            }
            return internal;
        } finally {
            hierarchy.release();
            MaskUtils.releaseAll(contours);
        }
    }

    /**
     * 障碍物数量：最终掩码中面积超过下限的外轮廓个数
     */
    public int countObstacles(Mat obstacleMask) {
        List<MatOfPoint> contours = MaskUtils.externalContours(obstacleMask);
        try {
            int count = 0;
            for (MatOfPoint cnt : contours) {
                if (Imgproc.contourArea(cnt) > config.getObstacleCountMinAreaPx()) {
                    count++;
                }
            }
            return count;
        } finally {
            MaskUtils.releaseAll(contours);
        }
    }
}
