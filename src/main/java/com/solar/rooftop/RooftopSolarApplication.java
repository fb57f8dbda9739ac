package com.solar.rooftop;

import com.solar.rooftop.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 屋顶光伏分析服务入口
 */
@SpringBootApplication
public class RooftopSolarApplication {

    public static void main(String[] args) {
        // OpenCV 必须在任何 Mat 创建之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(RooftopSolarApplication.class, args);
    }
}
