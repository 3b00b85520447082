package org.carball.tiercheck.model.scoring;

/**
 * Per-framework scores that feed the weighted composite.
 */
public record CalculationBreakdown(
        double woodScore,
        double campbellScore,
        double liuLiScore,
        double interactivityScore) {

    public static CalculationBreakdown zero() {
        return new CalculationBreakdown(0, 0, 0, 0);
    }
}
