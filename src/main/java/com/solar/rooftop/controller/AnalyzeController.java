package com.solar.rooftop.controller;

import com.solar.rooftop.core.InvalidInputException;
import com.solar.rooftop.core.energy.EnergyModel;
import com.solar.rooftop.core.model.AnalysisResult;
import com.solar.rooftop.model.ConfigOverrides;
import com.solar.rooftop.service.AnalysisArtifacts;
import com.solar.rooftop.service.RooftopAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 屋顶图像上传分析接口
 */
@RestController
@RequestMapping("/api")
@Tag(name = "屋顶分析", description = "上传卫星/航拍图像，检测屋顶并规划光伏板布局")
public class AnalyzeController {
    private static final Logger logger = LoggerFactory.getLogger(AnalyzeController.class);

    static final Set<String> ALLOWED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp", "bmp");

    @Autowired
    private RooftopAnalysisService analysisService;

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "分析屋顶图像",
            description = """
                    上传一张俯视图像，返回每个屋顶的光伏板布局、发电量估算和适宜度评分。

                    **支持格式**：png / jpg / jpeg / webp / bmp，最大 16MB

                    **输出文件**：
                    - 标注图：`/output/<name>_analysis.png`
                    - 原图：`/uploads/<name>.<ext>`
                    """
    )
    public ResponseEntity<Map<String, Object>> analyze(
            @Parameter(description = "屋顶图像文件", required = true)
            @RequestParam(value = "image", required = false) MultipartFile image,
            @Parameter(description = "纬度（默认取配置）", example = "28.6139")
            @RequestParam(value = "latitude", required = false) Double latitude,
            @Parameter(description = "经度（默认取配置）", example = "77.2090")
            @RequestParam(value = "longitude", required = false) Double longitude,
            @Parameter(description = "每像素米数（默认取配置）", example = "0.15")
            @RequestParam(value = "pixel_to_meter", required = false) Double pixelToMeter) {

        Map<String, Object> response = new HashMap<>();
        try {
            if (image == null || image.isEmpty()) {
                return badRequest(response, "No image file provided");
            }
            String extension = extensionOf(image.getOriginalFilename());
            if (!ALLOWED_EXTENSIONS.contains(extension)) {
                return badRequest(response, "Invalid file type. Allowed: png, jpg, jpeg, webp, bmp");
            }

            Path uploaded = store(image, extension);
            ConfigOverrides overrides = new ConfigOverrides(latitude, longitude, pixelToMeter);
            AnalysisArtifacts artifacts = analysisService.analyzeFile(uploaded, overrides);
            AnalysisResult result = artifacts.getResult();

            response.put("success", true);
            response.put("analyses", result.getAnalyses());
            response.put("failed_rooftops", result.getFailedRooftops());
            response.put("analysis_image_url", "/output/" + artifacts.getAnnotatedImage().getFileName());
            response.put("uploaded_image_url", "/uploads/" + uploaded.getFileName());
            response.put("total_panels", result.getTotalPanels());
            response.put("total_capacity_kw", EnergyModel.round(result.getTotalCapacityKw(), 2));
            response.put("total_annual_kwh", EnergyModel.round(result.getTotalAnnualKwh(), 0));
            response.put("total_co2_offset", EnergyModel.round(result.getTotalCo2OffsetKg(), 0));
            return ResponseEntity.ok(response);

        } catch (InvalidInputException e) {
            logger.warn("Rejected analysis request: {}", e.getMessage());
            return badRequest(response, e.getMessage());
        } catch (Exception e) {
            logger.error("Analysis failed", e);
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 以短随机名保存上传文件
     */
    private Path store(MultipartFile image, String extension) throws IOException {
        Path uploadDir = analysisService.getUploadDir();
        Files.createDirectories(uploadDir);
        String name = UUID.randomUUID().toString().replace("-", "").substring(0, 8) + "." + extension;
        Path target = uploadDir.resolve(name);
        image.transferTo(target.toAbsolutePath());
        logger.info("Upload saved: {} ({} bytes)", target, image.getSize());
        return target;
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static ResponseEntity<Map<String, Object>> badRequest(Map<String, Object> response, String error) {
        response.put("success", false);
        response.put("error", error);
        return ResponseEntity.badRequest().body(response);
    }
}
