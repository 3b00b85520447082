package org.carball.tiercheck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.carball.tiercheck.model.scoring.Bound;
import org.carball.tiercheck.model.scoring.Tier;

/**
 * Expected element interactivity ratio per tier.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class InteractivityThresholds {

    @Builder.Default
    @JsonProperty("simple_max")
    double simpleMax = 0.2;

    @Builder.Default
    @JsonProperty("moderate_min")
    double moderateMin = 0.2;

    @Builder.Default
    @JsonProperty("moderate_max")
    double moderateMax = 0.5;

    @Builder.Default
    @JsonProperty("complex_min")
    double complexMin = 0.5;

    public static InteractivityThresholds defaults() {
        return InteractivityThresholds.builder().build();
    }

    public Bound boundFor(Tier tier) {
        switch (tier) {
            case SIMPLE:
                return Bound.atMost(simpleMax);
            case MODERATE:
                return Bound.between(moderateMin, moderateMax);
            case COMPLEX:
            default:
                return Bound.atLeast(complexMin);
        }
    }
}
