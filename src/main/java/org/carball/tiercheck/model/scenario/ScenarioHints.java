package org.carball.tiercheck.model.scenario;

import lombok.Builder;

import java.util.List;

/**
 * Optional structured hints that accompany scenario text.
 */
@Builder
public record ScenarioHints(
        List<String> calculationSteps,
        List<ScenarioVariable> variables,
        List<Relationship> relationships,
        String domain) {

    public static ScenarioHints none() {
        return ScenarioHints.builder().build();
    }
}
