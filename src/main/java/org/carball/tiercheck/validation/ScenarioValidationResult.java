package org.carball.tiercheck.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import org.carball.tiercheck.model.scoring.ComplexityScore;

import java.time.Instant;
import java.util.List;

/**
 * Verdict for one scenario, with guidance for regenerating it when it was rejected.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScenarioValidationResult {

    String scenarioId;

    @JsonProperty("isValid")
    boolean valid;

    ComplexityScore complexityScore;
    Instant validationTimestamp;
    long validationDurationMs;
    boolean shouldRegenerate;
    String regenerationReason;

    @Builder.Default
    List<String> promptEnhancements = List.of();

    int regenerationAttempts;

    @JsonIgnore
    public ValidationOutcome outcome() {
        if (valid) {
            return ValidationOutcome.VALID;
        }
        return shouldRegenerate ? ValidationOutcome.INVALID_RETRY : ValidationOutcome.INVALID_EXHAUSTED;
    }
}
