package com.solar.rooftop.model;

import com.solar.rooftop.core.AnalysisConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次请求可覆盖的配置项，为 null 的项沿用默认配置
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigOverrides {
    private Double latitude;
    private Double longitude;
    private Double pixelToMeter;

    public static ConfigOverrides none() {
        return new ConfigOverrides();
    }

    public AnalysisConfig applyTo(AnalysisConfig base) {
        AnalysisConfig.AnalysisConfigBuilder builder = base.toBuilder();
        if (latitude != null) builder.latitude(latitude);
        if (longitude != null) builder.longitude(longitude);
        if (pixelToMeter != null) builder.pixelToMeter(pixelToMeter);
        return builder.build();
    }
}
