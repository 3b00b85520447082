package org.carball.tiercheck.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.model.scoring.Bound;
import org.carball.tiercheck.model.scoring.Tier;

import java.util.Locale;

/**
 * Immutable validation settings. Every call receives its own instance; there is no shared default.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class ComplexityValidationConfig {

    // Tier boundaries
    @Builder.Default
    @JsonProperty("tier_thresholds")
    TierThresholds tierThresholds = TierThresholds.defaults();

    @Builder.Default
    @JsonProperty("interactivity_thresholds")
    InteractivityThresholds interactivityThresholds = InteractivityThresholds.defaults();

    @Builder.Default
    @JsonProperty("weights")
    FrameworkWeights weights = FrameworkWeights.defaults();

    // Acceptance policy
    @Builder.Default
    @JsonProperty("strict_mode")
    boolean strictMode = false;

    @Builder.Default
    @JsonProperty("allowed_tier_deviation")
    int allowedTierDeviation = 1;

    @Builder.Default
    @JsonProperty("max_regeneration_attempts")
    int maxRegenerationAttempts = 3;

    @Builder.Default
    @JsonProperty("minimum_confidence")
    double minimumConfidence = 0.6;

    // Execution
    @Builder.Default
    @JsonProperty("validation_timeout_ms")
    long validationTimeoutMs = 5000;

    @Builder.Default
    @JsonProperty("batch_parallelism")
    int batchParallelism = Runtime.getRuntime().availableProcessors();

    // Profile information
    @Builder.Default
    @JsonProperty("profile_name")
    String profileName = "default";

    @Builder.Default
    @JsonProperty("profile_description")
    String profileDescription = "Lenient acceptance within one tier of the target";

    public static ComplexityValidationConfig defaults() {
        return ComplexityValidationConfig.builder().build();
    }

    public Tier classify(double overallScore) {
        return tierThresholds.classify(overallScore);
    }

    public Bound scoreRange(Tier tier) {
        return tierThresholds.rangeFor(tier);
    }

    /**
     * Logs warnings for settings that make scoring or acceptance inconsistent. Never throws.
     */
    public void validate() {
        if (!weights.isNormalized()) {
            log.warn("Framework weights sum to {} instead of 1.0; composite scores will not match tier thresholds",
                    String.format(Locale.ROOT, "%.3f", weights.sum()));
        }

        if (!tierThresholds.isAscending()) {
            log.warn("Tier thresholds should be ascending (simple {} < moderate {} < complex {})",
                    tierThresholds.getSimpleMin(), tierThresholds.getModerateMin(), tierThresholds.getComplexMin());
        }

        if (interactivityThresholds.getModerateMin() > interactivityThresholds.getModerateMax()) {
            log.warn("Moderate interactivity minimum ({}) is above its maximum ({})",
                    interactivityThresholds.getModerateMin(), interactivityThresholds.getModerateMax());
        }

        if (minimumConfidence < 0 || minimumConfidence > 1) {
            log.warn("Minimum confidence ({}) should be between 0 and 1", minimumConfidence);
        }

        if (allowedTierDeviation < 0 || allowedTierDeviation > 2) {
            log.warn("Allowed tier deviation ({}) should be between 0 and 2", allowedTierDeviation);
        }

        if (maxRegenerationAttempts < 0) {
            log.warn("Max regeneration attempts ({}) should not be negative", maxRegenerationAttempts);
        }

        if (batchParallelism < 1) {
            log.warn("Batch parallelism ({}) should be at least 1", batchParallelism);
        }

        log.debug("Using validation config - Strict: {}, Deviation: {}, MinConfidence: {}, Profile: {}",
                strictMode, allowedTierDeviation, minimumConfidence, profileName);
    }

    @JsonIgnore
    public String getConfigurationSummary() {
        return String.format(Locale.ROOT,
                "Profile: %s | Tiers: %.0f/%.0f | Strict: %s | Deviation: %d | Min confidence: %.2f | Max regenerations: %d",
                profileName, tierThresholds.getModerateMin(), tierThresholds.getComplexMin(),
                strictMode, allowedTierDeviation, minimumConfidence, maxRegenerationAttempts);
    }
}
