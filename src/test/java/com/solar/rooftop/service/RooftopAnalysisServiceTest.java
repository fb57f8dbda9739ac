package com.solar.rooftop.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solar.rooftop.config.NativeLibraryLoader;
import com.solar.rooftop.config.SolarProperties;
import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.InvalidInputException;
import com.solar.rooftop.core.TestImages;
import com.solar.rooftop.model.AnalysisReport;
import com.solar.rooftop.model.ConfigOverrides;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class RooftopAnalysisServiceTest {

    private final RooftopAnalysisService service =
            new RooftopAnalysisService(new SolarProperties(), new ReportWriter(), new GeoJsonExporter());

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    private Path writeImage(String name, Mat image) {
        Path file = tempDir.resolve(name);
        assertTrue(Imgcodecs.imwrite(file.toString(), image));
        image.release();
        return file;
    }

    @Test
    void analyzeFileWritesAllArtifacts() throws Exception {
        Path input = writeImage("roof.png", TestImages.blocks(400, 400, 210, new int[]{100, 100, 200, 200}));
        Path out = tempDir.resolve("out");

        AnalysisArtifacts artifacts = service.analyzeFile(input, ConfigOverrides.none(), out);

        assertEquals("roof", artifacts.getBaseName());
        assertEquals(out.resolve("roof_analysis.png"), artifacts.getAnnotatedImage());
        assertTrue(Files.exists(artifacts.getAnnotatedImage()));
        assertTrue(Files.exists(artifacts.getReport()));
        assertTrue(Files.exists(artifacts.getGeoJson()));
        assertEquals(1, artifacts.getResult().getAnalyses().size());

        Mat annotated = Imgcodecs.imread(artifacts.getAnnotatedImage().toString());
        try {
            assertEquals(400 + 120, annotated.rows());
        } finally {
            annotated.release();
        }

        AnalysisReport report = new ReportWriter().read(artifacts.getReport());
        assertEquals("roof.png", report.getInputImage());
        assertEquals(artifacts.getResult().getTotalPanels(), report.getSummary().getTotalPanels());
    }

    @Test
    void geoJsonRingIsClosed() throws Exception {
        Path input = writeImage("two.png",
                TestImages.blocks(400, 400, 210, new int[]{20, 20, 150, 150}, new int[]{220, 220, 150, 150}));

        AnalysisArtifacts artifacts = service.analyzeFile(input, ConfigOverrides.none(), tempDir);

        JsonNode root = new ObjectMapper().readTree(artifacts.getGeoJson().toFile());
        assertEquals("FeatureCollection", root.get("type").asText());
        assertEquals(2, root.get("features").size());
        for (JsonNode feature : root.get("features")) {
            assertEquals("Polygon", feature.get("geometry").get("type").asText());
            JsonNode ring = feature.get("geometry").get("coordinates").get(0);
            assertEquals(ring.get(0), ring.get(ring.size() - 1));
            assertTrue(ring.size() >= 4);
            JsonNode props = feature.get("properties");
            assertTrue(props.has("id"));
            assertTrue(props.has("area_m2"));
            assertTrue(props.has("panel_count"));
            assertTrue(props.has("rating"));
        }
    }

    @Test
    void overridesAreApplied() throws Exception {
        Path input = writeImage("scaled.png", TestImages.blocks(400, 400, 210, new int[]{100, 100, 200, 200}));

        AnalysisArtifacts artifacts = service.analyzeFile(input, new ConfigOverrides(10.0, 20.0, 0.3), tempDir);

        AnalysisConfig config = artifacts.getConfig();
        assertEquals(10.0, config.getLatitude());
        assertEquals(20.0, config.getLongitude());
        assertEquals(0.3, config.getPixelToMeter());
    }

    @Test
    void undecodableFileIsInvalidInput() throws Exception {
        Path bogus = tempDir.resolve("bogus.png");
        Files.writeString(bogus, "not an image");

        assertThrows(InvalidInputException.class,
                () -> service.analyzeFile(bogus, ConfigOverrides.none(), tempDir));
    }

    @Test
    void missingFileIsInvalidInput() {
        assertThrows(InvalidInputException.class,
                () -> service.analyzeFile(tempDir.resolve("missing.png"), ConfigOverrides.none(), tempDir));
    }

    @Test
    void invalidOverrideIsInvalidInput() {
        assertThrows(InvalidInputException.class,
                () -> service.effectiveConfig(new ConfigOverrides(120.0, null, null)));
    }

    @Test
    void baseNameDropsExtension() {
        assertEquals("roof", RooftopAnalysisService.baseName(Paths.get("dir", "roof.png")));
        assertEquals("a.b", RooftopAnalysisService.baseName(Paths.get("a.b.jpg")));
        assertEquals("noext", RooftopAnalysisService.baseName(Paths.get("noext")));
    }
}
