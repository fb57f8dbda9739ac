package com.solar.rooftop.core.placement;

import com.solar.rooftop.core.mask.MaskUtils;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * 可用区域：屋顶掩码按板尺寸比例腐蚀出边距，再减去障碍物
 */
public class UsableAreaResolver {

    private final double edgeMarginFraction;
    private final int minMarginPx;

    public UsableAreaResolver(double edgeMarginFraction, int minMarginPx) {
        this.edgeMarginFraction = edgeMarginFraction;
        this.minMarginPx = minMarginPx;
    }

    /**
     * 腐蚀核尺寸：max(minMargin, fraction * max(板宽, 板高))
     */
    public int marginPx(int panelWidthPx, int panelHeightPx) {
        return Math.max(minMarginPx, (int) (Math.max(panelWidthPx, panelHeightPx) * edgeMarginFraction));
    }

    /**
     * @return 可用掩码，调用方负责释放
     */
    public Mat resolve(Mat rooftopMask, Mat obstacleMask, int panelWidthPx, int panelHeightPx) {
        Mat kernel = MaskUtils.ellipseKernel(marginPx(panelWidthPx, panelHeightPx));
        Mat notObstacle = new Mat();
        try {
            Mat usable = new Mat();
            Imgproc.erode(rooftopMask, usable, kernel);
            Core.bitwise_not(obstacleMask, notObstacle);
            Core.bitwise_and(usable, notObstacle, usable);
            return usable;
        } finally {
            kernel.release();
            notObstacle.release();
        }
    }

    /**
     * 可用面积（平方米）
     */
    public static double usableAreaM2(Mat usableMask, double pixelToMeter) {
        return MaskUtils.countForeground(usableMask) * pixelToMeter * pixelToMeter;
    }
}
