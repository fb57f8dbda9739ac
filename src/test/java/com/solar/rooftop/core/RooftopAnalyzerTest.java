package com.solar.rooftop.core;

import com.solar.rooftop.config.NativeLibraryLoader;
import com.solar.rooftop.core.energy.EnergyModel;
import com.solar.rooftop.core.model.*;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import static org.junit.jupiter.api.Assertions.*;

class RooftopAnalyzerTest {

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    void singleSquareRoofGetsPanels() {
        AnalysisConfig config = AnalysisConfig.defaults();
        // 亮度 210：足以判定为预分割掩码，又不会被当作亮斑障碍物
        Mat image = TestImages.blocks(400, 400, 210, new int[]{100, 100, 200, 200});
        try {
            AnalysisResult result = new RooftopAnalyzer(config).analyze(image);

            assertEquals(400, result.getImageWidth());
            assertEquals(1, result.getAnalyses().size());
            assertTrue(result.getFailedRooftops().isEmpty());

            RooftopAnalysis analysis = result.getAnalyses().get(0);
            assertEquals(1, analysis.getRooftopId());
            assertEquals(0, analysis.getObstaclesDetected());
            assertTrue(analysis.getPanelCount() > 10, "panels: " + analysis.getPanelCount());
            assertEquals(analysis.getPanelCount(), analysis.getPanels().size());
            assertTrue(analysis.getUsableAreaM2() > 0 && analysis.getUsableAreaM2() < analysis.getRoofAreaM2());
            assertTrue(analysis.getPanelCount() * config.panelAreaM2() <= analysis.getUsableAreaM2());

            assertEquals(EnergyModel.estimate(analysis.getPanelCount(), config), analysis.getEnergy());
            assertEquals(100, analysis.getSuitability().getScore());
            assertEquals(Rating.EXCELLENT, analysis.getSuitability().getRating());
            assertNotNull(analysis.getRoofCharacteristics());
            assertTrue(analysis.getRoofCharacteristics().getAdjustedIrradiance() > 0);

            for (Panel panel : analysis.getPanels()) {
                assertTrue(panel.getCenter().x > 100 && panel.getCenter().x < 300);
                assertTrue(panel.getCenter().y > 100 && panel.getCenter().y < 300);
            }
        } finally {
            image.release();
        }
    }

    @Test
    void whiteCircleMaskIsFilledWithPanels() {
        // 200x200 预分割掩码：白色圆形屋顶，0.15 m/px，1.0x1.7 m 板，0.1 m 间距
        AnalysisConfig config = AnalysisConfig.defaults();
        Mat image = new Mat(200, 200, CvType.CV_8UC3, new Scalar(0, 0, 0));
        Imgproc.circle(image, new org.opencv.core.Point(100, 100), 90, new Scalar(255, 255, 255), -1);
        try {
            RooftopAnalyzer analyzer = new RooftopAnalyzer(config);
            AnalysisResult first = analyzer.analyze(image);

            assertEquals(1, first.getAnalyses().size());
            RooftopAnalysis analysis = first.getAnalyses().get(0);
            assertEquals(0, analysis.getObstaclesDetected());
            assertTrue(analysis.getUsableAreaM2() > 0);
            assertTrue(analysis.getPanelCount() > 0);

            long usablePx = Math.round(analysis.getUsableAreaM2() / (config.getPixelToMeter() * config.getPixelToMeter()));
            int panelPx = config.panelWidthPx() * config.panelHeightPx();
            assertTrue(analysis.getPanelCount() <= usablePx / panelPx,
                    analysis.getPanelCount() + " panels for " + usablePx + " usable px");

            AnalysisResult second = analyzer.analyze(image);
            assertEquals(analysis.getPanelCount(), second.getAnalyses().get(0).getPanelCount());
            assertEquals(analysis.getPanels(), second.getAnalyses().get(0).getPanels());
        } finally {
            image.release();
        }
    }

    @Test
    void analysisIsDeterministic() {
        Mat image = TestImages.blocks(400, 400, 220, new int[]{40, 40, 120, 150}, new int[]{220, 200, 140, 100});
        try {
            RooftopAnalyzer analyzer = new RooftopAnalyzer(AnalysisConfig.defaults());
            AnalysisResult first = analyzer.analyze(image);
            AnalysisResult second = analyzer.analyze(image);

            assertEquals(2, first.getAnalyses().size());
            assertEquals(first.getAnalyses().size(), second.getAnalyses().size());
            for (int i = 0; i < first.getAnalyses().size(); i++) {
                assertEquals(first.getAnalyses().get(i).getPanels(), second.getAnalyses().get(i).getPanels());
                assertEquals(first.getAnalyses().get(i).getSuitability(), second.getAnalyses().get(i).getSuitability());
            }
        } finally {
            image.release();
        }
    }

    @Test
    void blankImageGivesEmptyResult() {
        Mat image = TestImages.blocks(200, 200, 0);
        try {
            AnalysisResult result = new RooftopAnalyzer(AnalysisConfig.defaults()).analyze(image);

            assertTrue(result.isEmpty());
            assertEquals(0, result.getTotalPanels());
            assertEquals(0.0, result.getTotalCapacityKw());
            assertEquals(0.0, result.getTotalAnnualKwh());
        } finally {
            image.release();
        }
    }

    @Test
    void failingRooftopIsSkipped() {
        Mat image = TestImages.blocks(400, 400, 210, new int[]{20, 20, 150, 150}, new int[]{220, 220, 150, 150});
        RooftopAnalyzer analyzer = new RooftopAnalyzer(AnalysisConfig.defaults()) {
            @Override
            RooftopAnalysis analyzeRooftop(Mat img, Rooftop rooftop) {
                if (rooftop.getId() == 1) {
                    throw new RooftopAnalysisException(rooftop.getId(), "boom", new IllegalStateException("boom"));
                }
                return super.analyzeRooftop(img, rooftop);
            }
        };
        try {
            AnalysisResult result = analyzer.analyze(image);

            assertEquals(1, result.getAnalyses().size());
            assertEquals(2, result.getAnalyses().get(0).getRooftopId());
            assertEquals(java.util.List.of(1), result.getFailedRooftops());
        } finally {
            image.release();
        }
    }

    @Test
    void invalidConfigurationIsRejectedUpFront() {
        AnalysisConfig bad = AnalysisConfig.defaults().toBuilder().pixelToMeter(0).build();
        assertThrows(InvalidInputException.class, () -> new RooftopAnalyzer(bad));
    }

    @Test
    void totalsSumAcrossRooftops() {
        Mat image = TestImages.blocks(400, 400, 210, new int[]{20, 20, 150, 150}, new int[]{220, 220, 150, 150});
        try {
            AnalysisResult result = new RooftopAnalyzer(AnalysisConfig.defaults()).analyze(image);

            int panels = 0;
            double annual = 0;
            for (RooftopAnalysis a : result.getAnalyses()) {
                panels += a.getPanelCount();
                annual += a.getEnergy().getEstimatedAnnualKwh();
            }
            assertEquals(panels, result.getTotalPanels());
            assertEquals(annual, result.getTotalAnnualKwh(), 1e-9);
        } finally {
            image.release();
        }
    }
}
