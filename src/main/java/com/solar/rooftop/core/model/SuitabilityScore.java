package com.solar.rooftop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SuitabilityScore {
    int score;

    Rating rating;

    @JsonProperty("max_score")
    int maxScore;

    @JsonProperty("obstacles_found")
    int obstaclesFound;
}
