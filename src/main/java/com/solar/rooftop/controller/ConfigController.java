package com.solar.rooftop.controller;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.service.RooftopAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * 配置查询控制器
 */
@RestController
@RequestMapping("/api/config")
@Tag(name = "配置", description = "查询默认分析参数")
public class ConfigController {

    private static final Logger logger = LoggerFactory.getLogger(ConfigController.class);

    @Autowired
    private RooftopAnalysisService analysisService;

    /**
     * 当前生效的默认配置
     */
    @GetMapping("/defaults")
    @Operation(summary = "默认分析配置", description = "返回 application.yml 生效后的完整分析参数")
    public ResponseEntity<Map<String, Object>> getDefaults() {
        Map<String, Object> response = new HashMap<>();
        try {
            AnalysisConfig config = analysisService.effectiveConfig(null);
            response.put("success", true);
            response.put("config", config);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get default config", e);
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }
}
