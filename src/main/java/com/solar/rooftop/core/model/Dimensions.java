package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 宽高对
 */
@Value
public class Dimensions {
    double width;
    double height;

    @JsonCreator
    public Dimensions(@JsonProperty("width") double width, @JsonProperty("height") double height) {
        this.width = width;
        this.height = height;
    }
}
