package org.carball.tiercheck.model.scenario;

import lombok.Builder;
import org.carball.tiercheck.model.scoring.Tier;

import java.util.List;

/**
 * A generated scenario submitted for validation.
 */
@Builder(toBuilder = true)
public record ScenarioInput(
        String id,
        Tier intendedTier,
        String content,
        List<String> calculationSteps,
        List<ScenarioVariable> variables,
        List<Relationship> relationships,
        String domain,
        int regenerationAttempts) {

    public ScenarioInput {
        calculationSteps = ScenarioLists.compact(calculationSteps);
        variables = ScenarioLists.compact(variables);
        relationships = ScenarioLists.compact(relationships);
    }

    public static ScenarioInput of(String id, Tier intendedTier, String content, ScenarioHints hints) {
        ScenarioHints h = hints == null ? ScenarioHints.none() : hints;
        return ScenarioInput.builder()
                .id(id)
                .intendedTier(intendedTier)
                .content(content)
                .calculationSteps(h.calculationSteps())
                .variables(h.variables())
                .relationships(h.relationships())
                .domain(h.domain())
                .build();
    }

    /**
     * Returns the input for the next generation attempt, carrying the regenerated text.
     * Structured hints describe the previous text and are dropped.
     */
    public ScenarioInput nextAttempt(String regeneratedContent) {
        return ScenarioInput.builder()
                .id(id)
                .intendedTier(intendedTier)
                .content(regeneratedContent)
                .domain(domain)
                .regenerationAttempts(regenerationAttempts + 1)
                .build();
    }
}
