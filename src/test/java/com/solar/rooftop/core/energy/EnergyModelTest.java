package com.solar.rooftop.core.energy;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.model.EnergyEstimate;
import com.solar.rooftop.core.model.RoofCharacteristics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnergyModelTest {

    private final AnalysisConfig config = AnalysisConfig.defaults();

    @Test
    void zeroPanelsProduceZeroEnergy() {
        EnergyEstimate estimate = EnergyModel.estimate(0, config);

        assertEquals(0.0, estimate.getSystemCapacityKw());
        assertEquals(0.0, estimate.getTotalPanelAreaM2());
        assertEquals(0.0, estimate.getEstimatedAnnualKwh());
        assertEquals(0.0, estimate.getEstimatedMonthlyKwh());
        assertEquals(0.0, estimate.getEstimatedDailyKwh());
        assertEquals(0.0, estimate.getCo2OffsetKgYear());
    }

    @Test
    void tenPanelsAtNewDelhi() {
        EnergyEstimate estimate = EnergyModel.estimate(10, config);

        // 辐照量 2200 - 8 * 28.6139 = 1971.0888；年发电 17 * 1971.0888 * 0.2 * 0.86 = 5763.46
        assertEquals(3.0, estimate.getSystemCapacityKw());
        assertEquals(17.0, estimate.getTotalPanelAreaM2());
        assertEquals(5763.0, estimate.getEstimatedAnnualKwh());
        assertEquals(480.0, estimate.getEstimatedMonthlyKwh());
        assertEquals(15.8, estimate.getEstimatedDailyKwh());
        assertEquals(4726.0, estimate.getCo2OffsetKgYear());
    }

    @Test
    void irradianceFallsWithLatitude() {
        AnalysisConfig equator = config.toBuilder().latitude(0).build();
        AnalysisConfig south = config.toBuilder().latitude(-45).build();

        assertEquals(2200.0, EnergyModel.annualIrradiance(equator));
        assertEquals(1840.0, EnergyModel.annualIrradiance(south));
        assertTrue(EnergyModel.estimate(10, equator).getEstimatedAnnualKwh()
                > EnergyModel.estimate(10, south).getEstimatedAnnualKwh());
    }

    @Test
    void energyGrowsWithPanelCount() {
        double previous = -1;
        for (int n = 0; n <= 50; n += 5) {
            double annual = EnergyModel.estimate(n, config).getEstimatedAnnualKwh();
            assertTrue(annual > previous || n == 0);
            previous = annual;
        }
    }

    @Test
    void negativePanelCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EnergyModel.estimate(-1, config));
    }

    @Test
    void roundingHalfUp() {
        assertEquals(0.13, EnergyModel.round(0.125, 2), 1e-9);
        assertEquals(577.0, EnergyModel.round(576.5, 0));
    }

    @Test
    void southFacingRoofAtLatitudeSlopeKeepsFullIrradiance() {
        RoofCharacteristics roof = roof(180, 28.6139, 1.0);

        assertEquals(EnergyModel.annualIrradiance(config), EnergyModel.adjustedIrradiance(roof, config), 1e-9);
    }

    @Test
    void northFacingShadedRoofIsReduced() {
        // 1971.0888 * 0.75 * 1.0 * 0.5
        assertEquals(739.1583, EnergyModel.adjustedIrradiance(roof(0, 28.6139, 0.5), config), 1e-4);
        // 方位偏差按环绕计算：350° 与 180° 相差 170°
        assertEquals(1971.0888 * (1 - 170.0 / 180 * 0.25),
                EnergyModel.adjustedIrradiance(roof(350, 28.6139, 1.0), config), 1e-4);
    }

    @Test
    void southernHemisphereFavoursNorth() {
        AnalysisConfig south = AnalysisConfig.builder().latitude(-10).build();
        // 2200 - 80 = 2120；坡度 40 偏离 30°：1 - 30/90 * 0.15 = 0.95
        assertEquals(2120.0, EnergyModel.adjustedIrradiance(roof(0, 10, 1.0), south), 1e-9);
        assertEquals(2120.0 * 0.95, EnergyModel.adjustedIrradiance(roof(0, 40, 1.0), south), 1e-9);
    }

    private static RoofCharacteristics roof(double azimuth, double slope, double shading) {
        return RoofCharacteristics.builder()
                .roofType(RoofCharacteristicsAnalyzer.TYPE_FLAT)
                .azimuthDegrees(azimuth)
                .slopeDegrees(slope)
                .shadingScore(shading)
                .build();
    }
}
