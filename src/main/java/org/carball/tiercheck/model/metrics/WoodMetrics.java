package org.carball.tiercheck.model.metrics;

import lombok.Builder;

/**
 * Task complexity per Wood (1986): component, coordinative and dynamic complexity.
 *
 * @param distinctActs             number of distinct calculation acts, always within [2, 15]
 * @param informationCuesPerAct    distinct information cues divided by acts, one decimal
 * @param totalElements            {@code distinctActs * ceil(informationCuesPerAct)}
 * @param componentComplexityScore acts times cues scaled by the coordinative multiplier
 */
@Builder
public record WoodMetrics(
        int distinctActs,
        double informationCuesPerAct,
        int totalElements,
        CoordinativeComplexity coordinativeComplexity,
        DynamicComplexity dynamicComplexity,
        double componentComplexityScore) {
}
