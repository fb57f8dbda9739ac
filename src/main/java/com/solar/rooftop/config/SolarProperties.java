package com.solar.rooftop.config;

import com.solar.rooftop.core.AnalysisConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * application.yml 中 rooftop-solar 段的绑定
 * <p>
 * 默认值与 {@link AnalysisConfig} 保持一致，未配置的项沿用默认值
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rooftop-solar")
public class SolarProperties {
    private LocationConfig location = new LocationConfig();
    private ImagingConfig imaging = new ImagingConfig();
    private PanelConfig panel = new PanelConfig();
    private DetectionConfig detection = new DetectionConfig();
    private ObstacleConfig obstacle = new ObstacleConfig();
    private PlacementConfig placement = new PlacementConfig();
    private EnergyConfig energy = new EnergyConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private StorageConfig storage = new StorageConfig();

    @Data
    public static class LocationConfig {
        // 默认：新德里
        private double latitude = 28.6139;
        private double longitude = 77.2090;
    }

    @Data
    public static class ImagingConfig {
        // 每像素对应的米数（zoom 19 卫星图约 0.15）
        private double pixelToMeter = 0.15;
    }

    @Data
    public static class PanelConfig {
        private double widthM = 1.0;
        private double heightM = 1.7;
        private double powerW = 300;
        private double efficiency = 0.20;
        private double spacingM = 0.1;
    }

    @Data
    public static class DetectionConfig {
        private int brightPixelThreshold = 200;
        private double maskFractionMin = 0.05;
        private double maskFractionMax = 0.80;
        private int binarizeThreshold = 127;
        private double minMaskAreaPx = 100;
        private double minBuildingAreaPx = 500;
        private double maxBuildingAreaPx = 50000;
        private double overlapThreshold = 0.3;
        private List<Double> scales = new ArrayList<>(List.of(0.75, 1.0, 1.25));
        private int bilateralDiameter = 9;
        private double bilateralSigmaColor = 75;
        private double bilateralSigmaSpace = 75;
        private double cannyLow = 50;
        private double cannyHigh = 150;
    }

    @Data
    public static class ObstacleConfig {
        private double stdMultiplier = 2.0;
        private double uniformMaxStd = 1e-6;
        private double darkFloor = 20;
        private double brightCeiling = 235;
        private double internalMinAreaPx = 10;
        private double internalMaxAreaPx = 500;
        private int openKernelSize = 3;
        private int dilateKernelSize = 5;
        private double countMinAreaPx = 10;
    }

    @Data
    public static class PlacementConfig {
        private double edgeMarginFraction = 0.10;
        private int minEdgeMarginPx = 2;
        private double coverageThreshold = 0.90;
        private int minValidInteriorPoints = 3;
    }

    @Data
    public static class EnergyConfig {
        private double systemLoss = 0.14;
        private double irradianceBase = 2200;
        private double irradianceLatitudeSlope = 8;
        private double co2KgPerKwh = 0.82;
    }

    @Data
    public static class ScoringConfig {
        private int excellentCutoff = 80;
        private int goodCutoff = 60;
        private int fairCutoff = 40;
    }

    @Data
    public static class StorageConfig {
        private String uploadDir = "uploads";
        private String outputDir = "output";
    }

    /**
     * 生成一次分析使用的不可变配置
     */
    public AnalysisConfig toAnalysisConfig() {
        return AnalysisConfig.builder()
                .latitude(location.getLatitude())
                .longitude(location.getLongitude())
                .pixelToMeter(imaging.getPixelToMeter())
                .panelWidthM(panel.getWidthM())
                .panelHeightM(panel.getHeightM())
                .panelPowerW(panel.getPowerW())
                .panelEfficiency(panel.getEfficiency())
                .panelSpacingM(panel.getSpacingM())
                .brightPixelThreshold(detection.getBrightPixelThreshold())
                .maskFractionMin(detection.getMaskFractionMin())
                .maskFractionMax(detection.getMaskFractionMax())
                .binarizeThreshold(detection.getBinarizeThreshold())
                .minMaskAreaPx(detection.getMinMaskAreaPx())
                .minBuildingAreaPx(detection.getMinBuildingAreaPx())
                .maxBuildingAreaPx(detection.getMaxBuildingAreaPx())
                .overlapThreshold(detection.getOverlapThreshold())
                .detectionScales(List.copyOf(detection.getScales()))
                .bilateralDiameter(detection.getBilateralDiameter())
                .bilateralSigmaColor(detection.getBilateralSigmaColor())
                .bilateralSigmaSpace(detection.getBilateralSigmaSpace())
                .cannyLow(detection.getCannyLow())
                .cannyHigh(detection.getCannyHigh())
                .obstacleStdMultiplier(obstacle.getStdMultiplier())
                .uniformRoofMaxStd(obstacle.getUniformMaxStd())
                .darkFloor(obstacle.getDarkFloor())
                .brightCeiling(obstacle.getBrightCeiling())
                .internalMinAreaPx(obstacle.getInternalMinAreaPx())
                .internalMaxAreaPx(obstacle.getInternalMaxAreaPx())
                .openKernelSize(obstacle.getOpenKernelSize())
                .dilateKernelSize(obstacle.getDilateKernelSize())
                .obstacleCountMinAreaPx(obstacle.getCountMinAreaPx())
                .edgeMarginFraction(placement.getEdgeMarginFraction())
                .minEdgeMarginPx(placement.getMinEdgeMarginPx())
                .coverageThreshold(placement.getCoverageThreshold())
                .minValidInteriorPoints(placement.getMinValidInteriorPoints())
                .systemLoss(energy.getSystemLoss())
                .irradianceBase(energy.getIrradianceBase())
                .irradianceLatitudeSlope(energy.getIrradianceLatitudeSlope())
                .co2KgPerKwh(energy.getCo2KgPerKwh())
                .excellentCutoff(scoring.getExcellentCutoff())
                .goodCutoff(scoring.getGoodCutoff())
                .fairCutoff(scoring.getFairCutoff())
                .build();
    }
}
