package com.solar.rooftop.core.render;

import com.solar.rooftop.config.NativeLibraryLoader;
import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.RooftopAnalyzer;
import com.solar.rooftop.core.TestImages;
import com.solar.rooftop.core.model.AnalysisResult;
import com.solar.rooftop.core.model.Rating;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultAnnotatorTest {

    private final ResultAnnotator annotator = new ResultAnnotator();

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    void summaryStripIsAppended() {
        Mat image = TestImages.blocks(300, 400, 210, new int[]{100, 80, 150, 150});
        try {
            AnalysisResult result = new RooftopAnalyzer(AnalysisConfig.defaults()).analyze(image);
            Mat annotated = annotator.annotate(image, result);
            try {
                assertEquals(300 + ResultAnnotator.SUMMARY_HEIGHT, annotated.rows());
                assertEquals(400, annotated.cols());
                assertEquals(3, annotated.channels());
                // 原图未被修改
                assertEquals(210, (int) image.get(150, 170)[0]);
            } finally {
                annotated.release();
            }
        } finally {
            image.release();
        }
    }

    @Test
    void panelsArePaintedOverRoof() {
        Mat image = TestImages.blocks(300, 300, 210, new int[]{50, 50, 200, 200});
        try {
            AnalysisResult result = new RooftopAnalyzer(AnalysisConfig.defaults()).analyze(image);
            double[] center = {
                    result.getAnalyses().get(0).getPanels().get(0).getCenter().x,
                    result.getAnalyses().get(0).getPanels().get(0).getCenter().y
            };
            Mat drawn = annotator.drawResults(image, result);
            try {
                double[] pixel = drawn.get((int) center[1], (int) center[0]);
                // 板面填充色 BGR (255, 200, 0) 或描边色，总之不再是屋顶原色
                assertFalse(pixel[0] == 210 && pixel[1] == 210 && pixel[2] == 210);
            } finally {
                drawn.release();
            }
        } finally {
            image.release();
        }
    }

    @Test
    void grayscaleInputIsAnnotatedInColor() {
        Mat gray = new Mat(120, 160, CvType.CV_8UC1, new Scalar(0));
        AnalysisResult empty = new AnalysisResult(160, 120, List.of(), List.of());
        Mat annotated = annotator.annotate(gray, empty);
        try {
            assertEquals(3, annotated.channels());
            assertEquals(120 + ResultAnnotator.SUMMARY_HEIGHT, annotated.rows());
            // 汇总条背景
            double[] bg = annotated.get(annotated.rows() - 2, annotated.cols() - 2);
            assertArrayEquals(new double[]{40, 40, 40}, bg);
        } finally {
            gray.release();
            annotated.release();
        }
    }

    @Test
    void ratingColors() {
        assertEquals(new Scalar(0, 255, 0), ResultAnnotator.colorOf(Rating.EXCELLENT));
        assertEquals(new Scalar(0, 255, 255), ResultAnnotator.colorOf(Rating.GOOD));
        assertEquals(new Scalar(0, 165, 255), ResultAnnotator.colorOf(Rating.FAIR));
        assertEquals(new Scalar(0, 0, 255), ResultAnnotator.colorOf(Rating.POOR));
    }
}
