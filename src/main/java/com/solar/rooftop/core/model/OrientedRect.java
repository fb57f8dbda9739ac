package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.opencv.core.RotatedRect;

/**
 * 最小面积外接矩形摘要（width >= height）
 */
@Value
@Builder
@Jacksonized
public class OrientedRect {
    Point center;
    double width;
    double height;
    // OpenCV minAreaRect 的角度约定（度）
    @JsonProperty("angle")
    double angleDegrees;

    public static OrientedRect of(RotatedRect rect) {
        return OrientedRect.builder()
                .center(new Point(rect.center.x, rect.center.y))
                .width(Math.max(rect.size.width, rect.size.height))
                .height(Math.min(rect.size.width, rect.size.height))
                .angleDegrees(rect.angle)
                .build();
    }

    /**
     * 长宽比，高度为 0 时按 1 处理
     */
    public double aspectRatio() {
        return height > 0 ? width / height : 1.0;
    }
}
