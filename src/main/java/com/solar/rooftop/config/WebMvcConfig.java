package com.solar.rooftop.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web MVC 配置
 * <p>
 * 静态资源映射，让前端可以访问上传的原图和分析结果：
 * - /uploads/** -> 上传目录
 * - /output/**  -> 输出目录（标注图、JSON 报告、GeoJSON）
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Value("${rooftop-solar.storage.upload-dir:uploads}")
    private String uploadDir;

    @Value("${rooftop-solar.storage.output-dir:output}")
    private String outputDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(directoryLocation(uploadDir));
        registry.addResourceHandler("/output/**")
                .addResourceLocations(directoryLocation(outputDir));
    }

    /**
     * file: 形式的目录地址，必须以 / 结尾
     */
    static String directoryLocation(String dir) {
        String uri = Paths.get(dir).toAbsolutePath().normalize().toUri().toString();
        return uri.endsWith("/") ? uri : uri + "/";
    }
}
