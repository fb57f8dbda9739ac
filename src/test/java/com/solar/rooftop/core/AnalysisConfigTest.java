package com.solar.rooftop.core;

import com.solar.rooftop.config.SolarProperties;
import com.solar.rooftop.model.ConfigOverrides;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    private final AnalysisConfig defaults = AnalysisConfig.defaults();

    @Test
    void defaultsAreValid() {
        assertSame(defaults, defaults.validate());
        assertEquals(28.6139, defaults.getLatitude());
        assertEquals(0.15, defaults.getPixelToMeter());
        assertEquals(List.of(0.75, 1.0, 1.25), defaults.getDetectionScales());
    }

    @Test
    void panelSizeInPixels() {
        assertEquals(6, defaults.panelWidthPx());
        assertEquals(11, defaults.panelHeightPx());
        // 0.1 / 0.15 截断为 0，最小 1 像素
        assertEquals(1, defaults.panelSpacingPx());
        assertEquals(1.7, defaults.panelAreaM2(), 1e-9);
    }

    @Test
    void invalidValuesAreRejected() {
        assertInvalid(defaults.toBuilder().pixelToMeter(0).build());
        assertInvalid(defaults.toBuilder().pixelToMeter(-0.1).build());
        assertInvalid(defaults.toBuilder().panelWidthM(0).build());
        assertInvalid(defaults.toBuilder().panelPowerW(0).build());
        assertInvalid(defaults.toBuilder().panelEfficiency(0).build());
        assertInvalid(defaults.toBuilder().panelEfficiency(1.5).build());
        assertInvalid(defaults.toBuilder().systemLoss(1).build());
        assertInvalid(defaults.toBuilder().latitude(91).build());
        assertInvalid(defaults.toBuilder().longitude(-181).build());
        assertInvalid(defaults.toBuilder().minBuildingAreaPx(60000).build());
        assertInvalid(defaults.toBuilder().overlapThreshold(1.2).build());
        assertInvalid(defaults.toBuilder().coverageThreshold(-0.1).build());
        assertInvalid(defaults.toBuilder().detectionScales(List.of()).build());
        assertInvalid(defaults.toBuilder().detectionScales(List.of(1.0, 0.0)).build());
        // 板面小于一个像素
        assertInvalid(defaults.toBuilder().pixelToMeter(5).build());
    }

    @Test
    void propertiesDefaultsMatchConfigDefaults() {
        assertEquals(defaults, new SolarProperties().toAnalysisConfig());
    }

    @Test
    void overridesReplaceOnlyGivenFields() {
        AnalysisConfig config = new ConfigOverrides(-33.9, null, 0.3).applyTo(defaults);

        assertEquals(-33.9, config.getLatitude());
        assertEquals(defaults.getLongitude(), config.getLongitude());
        assertEquals(0.3, config.getPixelToMeter());
        assertEquals(defaults.getPanelPowerW(), config.getPanelPowerW());
        assertEquals(defaults, ConfigOverrides.none().applyTo(defaults));
    }

    private static void assertInvalid(AnalysisConfig config) {
        assertThrows(InvalidInputException.class, config::validate);
    }
}
