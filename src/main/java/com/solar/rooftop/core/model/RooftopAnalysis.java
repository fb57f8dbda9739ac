package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 单个屋顶的完整分析记录
 */
@Value
@Builder
@Jacksonized
public class RooftopAnalysis {
    @JsonProperty("rooftop_id")
    int rooftopId;

    @JsonProperty("roof_area_m2")
    double roofAreaM2;

    @JsonProperty("usable_area_m2")
    double usableAreaM2;

    @JsonProperty("roof_orientation_degrees")
    double roofOrientationDegrees;

    @JsonProperty("obstacles_detected")
    int obstaclesDetected;

    @JsonProperty("panel_count")
    int panelCount;

    List<Panel> panels;

    EnergyEstimate energy;

    SuitabilityScore suitability;

    @JsonProperty("roof_characteristics")
    RoofCharacteristics roofCharacteristics;

    // 只在进程内使用（标注、GeoJSON），不写入报告
    @JsonIgnore
    Rooftop rooftop;
}
