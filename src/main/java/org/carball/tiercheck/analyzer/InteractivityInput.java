package org.carball.tiercheck.analyzer;

import lombok.Builder;
import org.carball.tiercheck.model.scenario.ScenarioLists;
import org.carball.tiercheck.model.scenario.ScenarioVariable;

import java.util.List;

/**
 * Input for {@link InteractivityAnalyzer}. An explicit {@code totalElements}, zero included, wins over
 * every other source.
 */
@Builder
public record InteractivityInput(
        String content,
        Integer totalElements,
        Integer woodTotalElements,
        List<ScenarioVariable> variables,
        List<StepNode> steps) {

    /**
     * A calculation step, the elements it consumes and the elements it produces.
     */
    public record StepNode(String id, List<String> dependsOn, List<String> produces) {

        public StepNode {
            dependsOn = ScenarioLists.compact(dependsOn);
            produces = ScenarioLists.compact(produces);
        }
    }

    public InteractivityInput {
        variables = ScenarioLists.compact(variables);
        steps = ScenarioLists.compact(steps);
    }

    public static InteractivityInput ofContent(String content) {
        return InteractivityInput.builder().content(content).build();
    }
}
