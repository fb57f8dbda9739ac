package com.solar.rooftop.service;

import com.solar.rooftop.config.NativeLibraryLoader;
import com.solar.rooftop.config.SolarProperties;
import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.InvalidInputException;
import com.solar.rooftop.core.RooftopAnalyzer;
import com.solar.rooftop.core.model.AnalysisResult;
import com.solar.rooftop.core.render.ResultAnnotator;
import com.solar.rooftop.model.AnalysisReport;
import com.solar.rooftop.model.ConfigOverrides;
import jakarta.annotation.PostConstruct;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 屋顶光伏分析服务
 * <p>
 * 读取图像 → 运行分析流水线 → 输出标注图、JSON 报告和 GeoJSON
 */
@Service
public class RooftopAnalysisService {
    private static final Logger logger = LoggerFactory.getLogger(RooftopAnalysisService.class);

    public static final String ANNOTATED_SUFFIX = "_analysis.png";

    private final SolarProperties properties;
    private final ReportWriter reportWriter;
    private final GeoJsonExporter geoJsonExporter;
    private final ResultAnnotator annotator = new ResultAnnotator();

    @Autowired
    public RooftopAnalysisService(SolarProperties properties, ReportWriter reportWriter,
                                  GeoJsonExporter geoJsonExporter) {
        this.properties = properties;
        this.reportWriter = reportWriter;
        this.geoJsonExporter = geoJsonExporter;
    }

    @PostConstruct
    public void init() {
        NativeLibraryLoader.loadNativeLibraries();
        AnalysisConfig defaults = properties.toAnalysisConfig().validate();
        logger.info("Rooftop analysis service ready (lat={}, lon={}, scale={} m/px, panel {}x{} m)",
                defaults.getLatitude(), defaults.getLongitude(), defaults.getPixelToMeter(),
                defaults.getPanelWidthM(), defaults.getPanelHeightM());
    }

    /**
     * 默认配置 + 覆盖项，校验后返回
     *
     * @throws InvalidInputException 配置非法
     */
    public AnalysisConfig effectiveConfig(ConfigOverrides overrides) {
        AnalysisConfig base = properties.toAnalysisConfig();
        AnalysisConfig config = overrides == null ? base : overrides.applyTo(base);
        return config.validate();
    }

    public Path getUploadDir() {
        return Paths.get(properties.getStorage().getUploadDir());
    }

    public Path getOutputDir() {
        return Paths.get(properties.getStorage().getOutputDir());
    }

    /**
     * 对内存中的图像运行流水线，不写任何文件
     */
    public AnalysisResult analyze(Mat image, ConfigOverrides overrides) {
        return new RooftopAnalyzer(effectiveConfig(overrides)).analyze(image);
    }

    /**
     * 分析图像文件，输出写到默认输出目录
     */
    public AnalysisArtifacts analyzeFile(Path imagePath, ConfigOverrides overrides) throws IOException {
        return analyzeFile(imagePath, overrides, getOutputDir());
    }

    /**
     * 分析图像文件，并写出 &lt;name&gt;_analysis.png、&lt;name&gt;_panels.json、&lt;name&gt;_rooftops.geojson
     *
     * @throws InvalidInputException 图像无法读取或配置非法
     * @throws IOException           输出文件写入失败
     */
    public AnalysisArtifacts analyzeFile(Path imagePath, ConfigOverrides overrides, Path outputDir) throws IOException {
        AnalysisConfig config = effectiveConfig(overrides);

        if (!Files.isRegularFile(imagePath)) {
            throw new InvalidInputException("Image not found: " + imagePath);
        }
        Mat image = Imgcodecs.imread(imagePath.toString(), Imgcodecs.IMREAD_COLOR);
        Mat annotated = null;
        try {
            if (image.empty()) {
                throw new InvalidInputException("Could not decode image: " + imagePath.getFileName());
            }
            logger.info("Analyzing {} ({}x{})", imagePath.getFileName(), image.cols(), image.rows());

            AnalysisResult result = new RooftopAnalyzer(config).analyze(image);

            String baseName = baseName(imagePath);
            Files.createDirectories(outputDir);

            annotated = annotator.annotate(image, result);
            Path annotatedPath = outputDir.resolve(baseName + ANNOTATED_SUFFIX);
            if (!Imgcodecs.imwrite(annotatedPath.toString(), annotated)) {
                throw new IOException("Failed to write annotated image: " + annotatedPath);
            }
            logger.info("Annotated image saved: {}", annotatedPath);

            AnalysisReport report = AnalysisReport.of(imagePath.getFileName().toString(), config, result);
            Path reportPath = reportWriter.write(report, outputDir, baseName);
            Path geoJsonPath = geoJsonExporter.export(result, outputDir, baseName);

            return new AnalysisArtifacts(baseName, config, result, annotatedPath, reportPath, geoJsonPath);
        } finally {
            image.release();
            if (annotated != null) {
                annotated.release();
            }
        }
    }

    /**
     * 去掉扩展名的文件名
     */
    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
