package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 屋顶外观特征：类型、坡度、遮挡与方位角
 * <p>
 * 仅用于报告，不参与适宜度评分和发电量估算
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoofCharacteristics {
    @JsonProperty("roof_type")
    String roofType;

    @JsonProperty("slope_degrees")
    double slopeDegrees;

    // 0 完全遮挡 ~ 1 无遮挡
    @JsonProperty("shading_score")
    double shadingScore;

    // 0=北 90=东 180=南 270=西
    @JsonProperty("azimuth_degrees")
    double azimuthDegrees;

    // 按朝向、坡度、遮挡修正后的年辐照量（kWh/m²/年）
    @JsonProperty("adjusted_irradiance")
    double adjustedIrradiance;
}
