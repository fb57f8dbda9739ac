package com.solar.rooftop.service;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.energy.EnergyModel;
import com.solar.rooftop.core.model.*;
import com.solar.rooftop.model.AnalysisReport;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private final ReportWriter writer = new ReportWriter();

    @TempDir
    Path tempDir;

    private static RooftopAnalysis sampleAnalysis(AnalysisConfig config) {
        Panel panel = Panel.builder()
                .panelId(1)
                .center(new Point(13, 15.5))
                .corners(List.of(new Point(10, 10), new Point(16, 10), new Point(16, 21), new Point(10, 21)))
                .rotationDegrees(-12.5)
                .dimensionsPixels(new Dimensions(6, 11))
                .dimensionsMeters(new Dimensions(0.9, 1.65))
                .build();
        return RooftopAnalysis.builder()
                .rooftopId(1)
                .roofAreaM2(891.02)
                .usableAreaM2(870.5)
                .roofOrientationDegrees(-12.5)
                .obstaclesDetected(2)
                .panelCount(1)
                .panels(List.of(panel))
                .energy(EnergyModel.estimate(1, config))
                .suitability(SuitabilityScore.builder().score(65).rating(Rating.GOOD).maxScore(100).obstaclesFound(2).build())
                .roofCharacteristics(RoofCharacteristics.builder()
                        .roofType("flat").slopeDegrees(3.33).shadingScore(0.87).azimuthDegrees(102.5).build())
                .build();
    }

    @Test
    void reportRoundTripsThroughJson() throws Exception {
        AnalysisConfig config = AnalysisConfig.defaults();
        AnalysisResult result = new AnalysisResult(400, 300, List.of(sampleAnalysis(config)), List.of(2));
        AnalysisReport report = AnalysisReport.of("roof.png", config, result);

        Path file = writer.write(report, tempDir, "roof");
        AnalysisReport read = writer.read(file);

        assertEquals(tempDir.resolve("roof_panels.json"), file);
        assertEquals(report.getTimestamp(), read.getTimestamp());
        assertEquals("roof.png", read.getInputImage());
        assertEquals(400, read.getImageSize().getWidth());
        assertEquals(300, read.getImageSize().getHeight());
        assertEquals(config, read.getConfig());
        assertEquals(report.getSummary(), read.getSummary());
        assertEquals(report.getRooftops(), read.getRooftops());
        assertEquals(List.of(2), read.getFailedRooftops());
    }

    @Test
    void reportUsesSnakeCaseKeys() throws Exception {
        AnalysisConfig config = AnalysisConfig.defaults();
        AnalysisResult result = new AnalysisResult(400, 300, List.of(sampleAnalysis(config)), List.of());
        Path file = writer.write(AnalysisReport.of("roof.png", config, result), tempDir, "roof");

        JsonNode root = writer.getObjectMapper().readTree(Files.readString(file));
        JsonNode summary = root.get("summary");
        assertEquals(1, summary.get("rooftop_count").asInt());
        assertEquals(1, summary.get("total_panels").asInt());
        assertEquals(0.3, summary.get("total_capacity_kw").asDouble(), 1e-9);
        assertTrue(summary.has("total_annual_kwh"));
        assertTrue(summary.has("total_co2_offset"));

        JsonNode rooftop = root.get("rooftops").get(0);
        assertEquals(1, rooftop.get("rooftop_id").asInt());
        assertEquals("Good", rooftop.get("suitability").get("rating").asText());
        assertEquals(100, rooftop.get("suitability").get("max_score").asInt());
        assertTrue(rooftop.get("energy").has("co2_offset_kg_year"));
        assertTrue(rooftop.get("panels").get(0).has("rotation_degrees"));
        assertEquals("flat", rooftop.get("roof_characteristics").get("roof_type").asText());
        assertFalse(rooftop.has("rooftop"));
        assertTrue(root.get("timestamp").isTextual());
    }
}
