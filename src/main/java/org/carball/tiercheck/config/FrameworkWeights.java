package org.carball.tiercheck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Contribution of each framework to the composite score. Weights are expected to sum to 1.0.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FrameworkWeights {

    private static final double SUM_TOLERANCE = 1e-6;

    @Builder.Default
    @JsonProperty("wood")
    double wood = 0.25;

    @Builder.Default
    @JsonProperty("campbell")
    double campbell = 0.25;

    @Builder.Default
    @JsonProperty("liu_li")
    double liuLi = 0.30;

    @Builder.Default
    @JsonProperty("interactivity")
    double interactivity = 0.20;

    public static FrameworkWeights defaults() {
        return FrameworkWeights.builder().build();
    }

    public double sum() {
        return wood + campbell + liuLi + interactivity;
    }

    public boolean isNormalized() {
        return Math.abs(sum() - 1.0) < SUM_TOLERANCE;
    }
}
