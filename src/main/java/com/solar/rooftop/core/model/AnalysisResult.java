package com.solar.rooftop.core.model;

import java.util.Collections;
import java.util.List;

/**
 * 一张图像的分析结果：按检测顺序排列的屋顶记录，以及被跳过的屋顶编号
 */
public class AnalysisResult {
    private final int imageWidth;
    private final int imageHeight;
    private final List<RooftopAnalysis> analyses;
    private final List<Integer> failedRooftops;

    public AnalysisResult(int imageWidth, int imageHeight,
                          List<RooftopAnalysis> analyses, List<Integer> failedRooftops) {
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.analyses = Collections.unmodifiableList(analyses);
        this.failedRooftops = Collections.unmodifiableList(failedRooftops);
    }

    public int getImageWidth() { return imageWidth; }
    public int getImageHeight() { return imageHeight; }
    public List<RooftopAnalysis> getAnalyses() { return analyses; }
    public List<Integer> getFailedRooftops() { return failedRooftops; }

    public boolean isEmpty() {
        return analyses.isEmpty();
    }

    public int getTotalPanels() {
        return analyses.stream().mapToInt(RooftopAnalysis::getPanelCount).sum();
    }

    public double getTotalCapacityKw() {
        return analyses.stream().mapToDouble(a -> a.getEnergy().getSystemCapacityKw()).sum();
    }

    public double getTotalAnnualKwh() {
        return analyses.stream().mapToDouble(a -> a.getEnergy().getEstimatedAnnualKwh()).sum();
    }

    public double getTotalCo2OffsetKg() {
        return analyses.stream().mapToDouble(a -> a.getEnergy().getCo2OffsetKgYear()).sum();
    }
}
