package com.solar.rooftop.core.energy;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.model.EnergyEstimate;
import com.solar.rooftop.core.model.RoofCharacteristics;

/**
 * 发电量模型
 * <p>
 * 年辐照量按纬度线性折减：base - slope * |lat|（kWh/m²/年），不含季节与云量。
 * 年发电量 = 板面积 × 辐照量 × 效率 × (1 - 系统损耗)。
 */
public final class EnergyModel {

    private EnergyModel() {
    }

    public static EnergyEstimate estimate(int panelCount, AnalysisConfig config) {
        if (panelCount < 0) {
            throw new IllegalArgumentException("panelCount must not be negative: " + panelCount);
        }
        double totalAreaM2 = panelCount * config.panelAreaM2();
        double capacityKw = panelCount * config.getPanelPowerW() / 1000.0;
        double annualKwh = totalAreaM2 * annualIrradiance(config)
                * config.getPanelEfficiency() * (1 - config.getSystemLoss());

        return EnergyEstimate.builder()
                .systemCapacityKw(round(capacityKw, 2))
                .totalPanelAreaM2(round(totalAreaM2, 2))
                .estimatedAnnualKwh(round(annualKwh, 0))
                .estimatedMonthlyKwh(round(annualKwh / 12, 0))
                .estimatedDailyKwh(round(annualKwh / 365, 1))
                .co2OffsetKgYear(round(annualKwh * config.getCo2KgPerKwh(), 0))
                .build();
    }

    /**
     * 年辐照量（kWh/m²/年）
     */
    public static double annualIrradiance(AnalysisConfig config) {
        return config.getIrradianceBase() - config.getIrradianceLatitudeSlope() * Math.abs(config.getLatitude());
    }

    /**
     * 按屋顶特征修正的年辐照量（kWh/m²/年），只写入报告
     * <p>
     * 朝向：偏离最优方位（北半球朝南 180°，否则朝北 0°）每 180° 折减 25%；
     * 坡度：偏离 |纬度| 每 90° 折减 15%；最后乘以遮挡系数。
     */
    public static double adjustedIrradiance(RoofCharacteristics roof, AnalysisConfig config) {
        double latitude = config.getLatitude();
        double optimalAzimuth = latitude > 0 ? 180 : 0;
        double azimuthDeviation = Math.abs(roof.getAzimuthDegrees() - optimalAzimuth);
        azimuthDeviation = Math.min(azimuthDeviation, 360 - azimuthDeviation);
        double orientationFactor = 1.0 - (azimuthDeviation / 180) * 0.25;

        double slopeDeviation = Math.abs(roof.getSlopeDegrees() - Math.abs(latitude));
        double slopeFactor = 1.0 - (slopeDeviation / 90) * 0.15;

        return annualIrradiance(config) * orientationFactor * slopeFactor * roof.getShadingScore();
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
