package org.carball.tiercheck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.carball.tiercheck.model.scoring.Bound;
import org.carball.tiercheck.model.scoring.Tier;

/**
 * Composite score boundaries between tiers. The complex tier has no upper bound.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TierThresholds {

    @Builder.Default
    @JsonProperty("simple_min")
    double simpleMin = 0;

    @Builder.Default
    @JsonProperty("moderate_min")
    double moderateMin = 15;

    @Builder.Default
    @JsonProperty("complex_min")
    double complexMin = 30;

    public static TierThresholds defaults() {
        return TierThresholds.builder().build();
    }

    public Tier classify(double score) {
        if (score < moderateMin) {
            return Tier.SIMPLE;
        } else if (score < complexMin) {
            return Tier.MODERATE;
        } else {
            return Tier.COMPLEX;
        }
    }

    public Bound rangeFor(Tier tier) {
        switch (tier) {
            case SIMPLE:
                return Bound.between(simpleMin, moderateMin);
            case MODERATE:
                return Bound.between(moderateMin, complexMin);
            case COMPLEX:
            default:
                return Bound.between(complexMin, Double.POSITIVE_INFINITY);
        }
    }

    public boolean isAscending() {
        return simpleMin < moderateMin && moderateMin < complexMin;
    }
}
