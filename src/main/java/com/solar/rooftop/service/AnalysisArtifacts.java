package com.solar.rooftop.service;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.model.AnalysisResult;

import java.nio.file.Path;

/**
 * 一次分析的结果及输出文件位置
 */
public class AnalysisArtifacts {
    private final String baseName;
    private final AnalysisConfig config;
    private final AnalysisResult result;
    private final Path annotatedImage;
    private final Path report;
    private final Path geoJson;

    public AnalysisArtifacts(String baseName, AnalysisConfig config, AnalysisResult result,
                             Path annotatedImage, Path report, Path geoJson) {
        this.baseName = baseName;
        this.config = config;
        this.result = result;
        this.annotatedImage = annotatedImage;
        this.report = report;
        this.geoJson = geoJson;
    }

    public String getBaseName() { return baseName; }
    public AnalysisConfig getConfig() { return config; }
    public AnalysisResult getResult() { return result; }
    public Path getAnnotatedImage() { return annotatedImage; }
    public Path getReport() { return report; }
    public Path getGeoJson() { return geoJson; }
}
