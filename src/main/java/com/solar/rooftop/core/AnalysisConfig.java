package com.solar.rooftop.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 一次分析的不可变配置
 * <p>
 * 每个阶段只读取，不会在分析过程中修改。所有启发式阈值都以具名字段暴露，
 * 默认值即参考实现的取值。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalysisConfig {

    // ---- 位置与分辨率 ----
    @Builder.Default double latitude = 28.6139;
    @Builder.Default double longitude = 77.2090;
    @Builder.Default double pixelToMeter = 0.15;

    // ---- 光伏板规格 ----
    @Builder.Default double panelWidthM = 1.0;
    @Builder.Default double panelHeightM = 1.7;
    @Builder.Default double panelPowerW = 300;
    @Builder.Default double panelEfficiency = 0.20;
    @Builder.Default double panelSpacingM = 0.1;

    // ---- 屋顶检测 ----
    @Builder.Default int brightPixelThreshold = 200;
    @Builder.Default double maskFractionMin = 0.05;
    @Builder.Default double maskFractionMax = 0.80;
    @Builder.Default int binarizeThreshold = 127;
    @Builder.Default double minMaskAreaPx = 100;
    @Builder.Default double minBuildingAreaPx = 500;
    @Builder.Default double maxBuildingAreaPx = 50000;
    @Builder.Default double overlapThreshold = 0.3;
    @Builder.Default List<Double> detectionScales = List.of(0.75, 1.0, 1.25);
    @Builder.Default int bilateralDiameter = 9;
    @Builder.Default double bilateralSigmaColor = 75;
    @Builder.Default double bilateralSigmaSpace = 75;
    @Builder.Default double cannyLow = 50;
    @Builder.Default double cannyHigh = 150;

    // ---- 障碍物检测 ----
    @Builder.Default double obstacleStdMultiplier = 2.0;
    // 屋顶灰度标准差低于此值视为均匀，不做偏暗/偏亮检测
    @Builder.Default double uniformRoofMaxStd = 1e-6;
    @Builder.Default double darkFloor = 20;
    @Builder.Default double brightCeiling = 235;
    @Builder.Default double internalMinAreaPx = 10;
    @Builder.Default double internalMaxAreaPx = 500;
    @Builder.Default int openKernelSize = 3;
    @Builder.Default int dilateKernelSize = 5;
    @Builder.Default double obstacleCountMinAreaPx = 10;

    // ---- 排布 ----
    @Builder.Default double edgeMarginFraction = 0.10;
    @Builder.Default int minEdgeMarginPx = 2;
    @Builder.Default double coverageThreshold = 0.90;
    @Builder.Default int minValidInteriorPoints = 3;

    // ---- 发电量 ----
    @Builder.Default double systemLoss = 0.14;
    @Builder.Default double irradianceBase = 2200;
    @Builder.Default double irradianceLatitudeSlope = 8;
    @Builder.Default double co2KgPerKwh = 0.82;

    // ---- 评级分档 ----
    @Builder.Default int excellentCutoff = 80;
    @Builder.Default int goodCutoff = 60;
    @Builder.Default int fairCutoff = 40;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }

    /**
     * 单板宽度（像素，向下取整）
     */
    public int panelWidthPx() {
        return (int) (panelWidthM / pixelToMeter);
    }

    /**
     * 单板高度（像素，向下取整）
     */
    public int panelHeightPx() {
        return (int) (panelHeightM / pixelToMeter);
    }

    /**
     * 板间距（像素，至少 1）
     */
    public int panelSpacingPx() {
        return Math.max(1, (int) (panelSpacingM / pixelToMeter));
    }

    public double panelAreaM2() {
        return panelWidthM * panelHeightM;
    }

    /**
     * 校验配置，非法时抛出 {@link InvalidInputException}
     */
    public AnalysisConfig validate() {
        require(pixelToMeter > 0, "pixelToMeter must be positive: " + pixelToMeter);
        require(latitude >= -90 && latitude <= 90, "latitude out of range: " + latitude);
        require(longitude >= -180 && longitude <= 180, "longitude out of range: " + longitude);
        require(panelWidthM > 0 && panelHeightM > 0,
                "panel dimensions must be positive: " + panelWidthM + " x " + panelHeightM);
        require(panelWidthPx() > 0 && panelHeightPx() > 0,
                "panel is smaller than one pixel at scale " + pixelToMeter);
        require(panelPowerW > 0, "panelPowerW must be positive: " + panelPowerW);
        require(panelEfficiency > 0 && panelEfficiency <= 1, "panelEfficiency out of range: " + panelEfficiency);
        require(panelSpacingM >= 0, "panelSpacingM must not be negative: " + panelSpacingM);
        require(systemLoss >= 0 && systemLoss < 1, "systemLoss out of range: " + systemLoss);
        require(minBuildingAreaPx < maxBuildingAreaPx,
                "minBuildingAreaPx must be below maxBuildingAreaPx: " + minBuildingAreaPx + " / " + maxBuildingAreaPx);
        require(maskFractionMin < maskFractionMax, "maskFractionMin must be below maskFractionMax");
        require(overlapThreshold >= 0 && overlapThreshold <= 1, "overlapThreshold out of range: " + overlapThreshold);
        require(coverageThreshold >= 0 && coverageThreshold <= 1, "coverageThreshold out of range: " + coverageThreshold);
        require(minValidInteriorPoints >= 0 && minValidInteriorPoints <= 4,
                "minValidInteriorPoints out of range: " + minValidInteriorPoints);
        require(edgeMarginFraction >= 0, "edgeMarginFraction must not be negative: " + edgeMarginFraction);
        require(uniformRoofMaxStd >= 0, "uniformRoofMaxStd must not be negative: " + uniformRoofMaxStd);
        require(openKernelSize > 0 && dilateKernelSize > 0, "kernel sizes must be positive");
        require(detectionScales != null && !detectionScales.isEmpty(), "detectionScales must not be empty");
        for (Double scale : detectionScales) {
            require(scale != null && scale > 0, "detection scale must be positive: " + scale);
        }
        require(excellentCutoff >= goodCutoff && goodCutoff >= fairCutoff, "rating cut-offs must be descending");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidInputException(message);
        }
    }
}
