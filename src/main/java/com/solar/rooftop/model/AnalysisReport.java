package com.solar.rooftop.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.energy.EnergyModel;
import com.solar.rooftop.core.model.AnalysisResult;
import com.solar.rooftop.core.model.RooftopAnalysis;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 写入 &lt;name&gt;_panels.json 的分析报告
 */
@Data
public class AnalysisReport {
    private LocalDateTime timestamp;

    @JsonProperty("input_image")
    private String inputImage;

    @JsonProperty("image_size")
    private ImageSize imageSize;

    private AnalysisConfig config;

    private Summary summary;

    private List<RooftopAnalysis> rooftops = new ArrayList<>();

    @JsonProperty("failed_rooftops")
    private List<Integer> failedRooftops = new ArrayList<>();

    public static AnalysisReport of(String inputImage, AnalysisConfig config, AnalysisResult result) {
        AnalysisReport report = new AnalysisReport();
        report.timestamp = LocalDateTime.now();
        report.inputImage = inputImage;
        report.imageSize = new ImageSize(result.getImageWidth(), result.getImageHeight());
        report.config = config;
        report.summary = Summary.of(result);
        report.rooftops = new ArrayList<>(result.getAnalyses());
        report.failedRooftops = new ArrayList<>(result.getFailedRooftops());
        return report;
    }

    @Data
    public static class ImageSize {
        private int width;
        private int height;

        public ImageSize() {
        }

        public ImageSize(int width, int height) {
            this.width = width;
            this.height = height;
        }
    }

    @Data
    public static class Summary {
        @JsonProperty("rooftop_count")
        private int rooftopCount;

        @JsonProperty("total_panels")
        private int totalPanels;

        @JsonProperty("total_capacity_kw")
        private double totalCapacityKw;

        @JsonProperty("total_annual_kwh")
        private double totalAnnualKwh;

        @JsonProperty("total_co2_offset")
        private double totalCo2Offset;

        static Summary of(AnalysisResult result) {
            Summary summary = new Summary();
            summary.rooftopCount = result.getAnalyses().size();
            summary.totalPanels = result.getTotalPanels();
            summary.totalCapacityKw = EnergyModel.round(result.getTotalCapacityKw(), 2);
            summary.totalAnnualKwh = EnergyModel.round(result.getTotalAnnualKwh(), 0);
            summary.totalCo2Offset = EnergyModel.round(result.getTotalCo2OffsetKg(), 0);
            return summary;
        }
    }
}
