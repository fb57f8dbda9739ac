package com.solar.rooftop.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.solar.rooftop.model.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON 报告读写
 */
@Component
public class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    public static final String SUFFIX = "_panels.json";

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 写入 outputDir/&lt;baseName&gt;_panels.json
     *
     * @return 报告文件路径
     */
    public Path write(AnalysisReport report, Path outputDir, String baseName) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(baseName + SUFFIX);
        objectMapper.writeValue(file.toFile(), report);
        logger.info("Report saved: {}", file);
        return file;
    }

    public AnalysisReport read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), AnalysisReport.class);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
