package org.carball.tiercheck.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import org.carball.tiercheck.model.scoring.ComplexityScore;
import org.carball.tiercheck.model.scoring.Tier;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationProgressEvent {

    ProgressEventType type;
    int current;
    int total;
    int percentage;
    String scenarioId;
    ResultSummary validationResult;
    ValidationBatchStats batchStats;
    String message;
    Long elapsedMs;

    /**
     * Headline numbers of one scenario's validation.
     */
    public record ResultSummary(
            @JsonProperty("isValid") boolean valid,
            boolean tierMatch,
            Tier predictedTier,
            Tier intendedTier,
            double confidenceScore,
            double overallScore) {

        public static ResultSummary of(boolean valid, ComplexityScore score) {
            return new ResultSummary(valid, score.tierMatch(), score.predictedTier(), score.intendedTier(),
                    score.confidenceScore(), score.overallScore());
        }
    }

    public static int percentage(int current, int total) {
        return total == 0 ? 100 : (int) Math.round(current * 100.0 / total);
    }
}
