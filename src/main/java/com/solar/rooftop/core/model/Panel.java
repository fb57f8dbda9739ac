package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 单块光伏板的几何信息
 * <p>
 * corners 顺序为 左上、右上、右下、左下（旋转后），坐标保留两位小数
 */
@Value
@Builder
@Jacksonized
public class Panel {
    @JsonProperty("panel_id")
    int panelId;

    Point center;

    List<Point> corners;

    @JsonProperty("rotation_degrees")
    double rotationDegrees;

    @JsonProperty("dimensions_pixels")
    Dimensions dimensionsPixels;

    @JsonProperty("dimensions_meters")
    Dimensions dimensionsMeters;
}
