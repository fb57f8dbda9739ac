package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 屋顶适宜度等级
 */
public enum Rating {
    POOR("Poor"),
    FAIR("Fair"),
    GOOD("Good"),
    EXCELLENT("Excellent");

    private final String label;

    Rating(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Rating fromLabel(String label) {
        for (Rating rating : values()) {
            if (rating.label.equalsIgnoreCase(label) || rating.name().equalsIgnoreCase(label)) {
                return rating;
            }
        }
        throw new IllegalArgumentException("Unknown rating: " + label);
    }
}
