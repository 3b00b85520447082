package org.carball.tiercheck.model.metrics;

import lombok.Builder;

/**
 * Liu &amp; Li (2012) task complexity dimensions. Ratios are on a 0-1 scale.
 */
@Builder
public record LiuLiDimensions(
        int size,
        double variety,
        double ambiguity,
        double relationships,
        double variability,
        double unreliability,
        NoveltyLevel novelty,
        double incongruity,
        int actionComplexity,
        TimePressure timePressure) {
}
