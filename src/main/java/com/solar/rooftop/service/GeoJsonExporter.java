package com.solar.rooftop.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solar.rooftop.core.model.AnalysisResult;
import com.solar.rooftop.core.model.Polygon;
import com.solar.rooftop.core.model.RooftopAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 屋顶轮廓导出为 GeoJSON FeatureCollection（像素坐标）
 */
@Component
public class GeoJsonExporter {
    private static final Logger logger = LoggerFactory.getLogger(GeoJsonExporter.class);

    public static final String SUFFIX = "_rooftops.geojson";

    private final ObjectMapper objectMapper;

    public GeoJsonExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toFeatureCollection(AnalysisResult result) {
        ObjectNode collection = objectMapper.createObjectNode();
        collection.put("type", "FeatureCollection");
        ArrayNode features = collection.putArray("features");

        for (RooftopAnalysis analysis : result.getAnalyses()) {
            if (analysis.getRooftop() == null) {
                continue;
            }
            ObjectNode feature = features.addObject();
            feature.put("type", "Feature");

            ObjectNode geometry = feature.putObject("geometry");
            geometry.put("type", "Polygon");
            ArrayNode ring = geometry.putArray("coordinates").addArray();
            Polygon boundary = analysis.getRooftop().getBoundary();
            for (int i = 0; i < boundary.size(); i++) {
                ring.addArray().add(boundary.getX(i)).add(boundary.getY(i));
            }
            // 闭合
            if (boundary.size() > 0) {
                ring.addArray().add(boundary.getX(0)).add(boundary.getY(0));
            }

            ObjectNode properties = feature.putObject("properties");
            properties.put("id", analysis.getRooftopId());
            properties.put("area_m2", analysis.getRoofAreaM2());
            properties.put("panel_count", analysis.getPanelCount());
            properties.put("rating", analysis.getSuitability().getRating().getLabel());
        }
        return collection;
    }

    /**
     * 写入 outputDir/&lt;baseName&gt;_rooftops.geojson
     */
    public Path export(AnalysisResult result, Path outputDir, String baseName) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(baseName + SUFFIX);
        objectMapper.writeValue(file.toFile(), toFeatureCollection(result));
        logger.info("GeoJSON saved: {}", file);
        return file;
    }
}
