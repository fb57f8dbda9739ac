package com.solar.rooftop.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rooftopSolarOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Rooftop Solar Analyzer API")
                        .description("""
                                屋顶光伏分析系统 API 文档

                                ## 功能概述

                                从卫星/航拍图像中检测屋顶，规划光伏板布局并估算发电量。

                                ### 处理流程
                                | 阶段 | 说明 |
                                |------|------|
                                | 屋顶检测 | 自动判断输入是分割掩码还是原始影像 |
                                | 障碍物检测 | 烟囱、通风口、天窗等 |
                                | 可用区域 | 边缘留白并扣除障碍物 |
                                | 光伏排布 | 横向/纵向各排一次，取板数多者 |
                                | 发电估算 | 按纬度估算年辐照量 |
                                | 适宜度评分 | 面积、板数、形状、障碍物 |

                                ### API 响应格式
                                ```json
                                {
                                  "success": true,
                                  "analyses": [ ... ],
                                  "error": "错误信息（仅失败时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Rooftop Solar Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为 POST 接口补充统一的 400 响应说明
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
            }
        });
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "success", new Schema<>().type("boolean").example(false),
                "error", new Schema<>().type("string").description("错误信息").example("No image file provided")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
