package org.carball.tiercheck.model.metrics;

import lombok.Builder;

@Builder
public record ElementInteractivityAnalysis(
        int totalElements,
        int simultaneousElements,
        double interactivityRatio,
        int dependencyDepth,
        int dependencyEdges) {
}
