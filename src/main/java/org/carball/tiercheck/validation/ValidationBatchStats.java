package org.carball.tiercheck.validation;

import lombok.Builder;
import lombok.Value;
import org.carball.tiercheck.model.scoring.ComplexityScore;
import org.carball.tiercheck.model.scoring.Tier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate figures for a batch. Rates and averages are 0 for an empty batch.
 * Tier maps are keyed by tier label.
 */
@Value
@Builder
public class ValidationBatchStats {

    int totalValidated;
    int passed;
    int failed;
    double passRate;
    double avgConfidenceScore;
    Map<String, Integer> intendedTierDistribution;
    Map<String, Integer> predictedTierDistribution;
    Map<String, Double> tierMatchRate;
    double avgValidationTimeMs;
    int totalRegenerationAttempts;

    public static ValidationBatchStats from(List<ScenarioValidationResult> results) {
        int total = results.size();
        int passed = 0;
        double totalConfidence = 0;
        double totalTime = 0;
        int totalAttempts = 0;

        Map<String, Integer> intended = new LinkedHashMap<>();
        Map<String, Integer> predicted = new LinkedHashMap<>();
        Map<String, Integer> matched = new LinkedHashMap<>();

        for (ScenarioValidationResult result : results) {
            ComplexityScore score = result.getComplexityScore();
            if (result.isValid()) {
                passed++;
            }

            String intendedLabel = label(score.intendedTier());
            intended.merge(intendedLabel, 1, Integer::sum);
            predicted.merge(label(score.predictedTier()), 1, Integer::sum);
            matched.merge(intendedLabel, score.tierMatch() ? 1 : 0, Integer::sum);

            totalConfidence += score.confidenceScore();
            totalTime += result.getValidationDurationMs();
            totalAttempts += result.getRegenerationAttempts();
        }

        Map<String, Double> matchRate = new LinkedHashMap<>();
        intended.forEach((tier, count) -> matchRate.put(tier, count > 0 ? matched.get(tier) / (double) count : 0));

        return ValidationBatchStats.builder()
                .totalValidated(total)
                .passed(passed)
                .failed(total - passed)
                .passRate(total > 0 ? passed / (double) total : 0)
                .avgConfidenceScore(total > 0 ? totalConfidence / total : 0)
                .intendedTierDistribution(Collections.unmodifiableMap(intended))
                .predictedTierDistribution(Collections.unmodifiableMap(predicted))
                .tierMatchRate(Collections.unmodifiableMap(matchRate))
                .avgValidationTimeMs(total > 0 ? totalTime / total : 0)
                .totalRegenerationAttempts(totalAttempts)
                .build();
    }

    private static String label(Tier tier) {
        return tier == null ? "unknown" : tier.getLabel();
    }
}
