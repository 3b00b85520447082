package org.carball.tiercheck.model.scoring;

import lombok.Builder;
import org.carball.tiercheck.model.metrics.CampbellAttributes;
import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.metrics.LiuLiDimensions;
import org.carball.tiercheck.model.metrics.WoodMetrics;

import java.util.List;

/**
 * Composite complexity judgment for one scenario.
 *
 * @param overallScore    weighted sum of the framework scores, one decimal
 * @param confidenceScore share of requirement checks the scenario passes for its predicted tier, in [0, 1]
 */
@Builder(toBuilder = true)
public record ComplexityScore(
        double overallScore,
        Tier predictedTier,
        Tier intendedTier,
        boolean tierMatch,
        double confidenceScore,
        WoodMetrics woodMetrics,
        CampbellAttributes campbellAttributes,
        LiuLiDimensions liuLiDimensions,
        ElementInteractivityAnalysis elementInteractivity,
        CalculationBreakdown calculationBreakdown,
        ValidationFlags validationFlags,
        List<String> rejectionReasons,
        String analyzerVersion) {

    public ComplexityScore {
        rejectionReasons = rejectionReasons == null ? List.of() : List.copyOf(rejectionReasons);
    }
}
