package org.carball.tiercheck.analyzer;

import lombok.Builder;
import org.carball.tiercheck.model.scenario.ScenarioLists;

import java.util.List;

/**
 * Input for {@link WoodAnalyzer}. {@code null} flags mean "not specified"; the analyzer then reads the text.
 */
@Builder
public record WoodAnalysisInput(
        String content,
        List<String> calculationSteps,
        List<String> variables,
        Boolean hasConditionals,
        Boolean hasStateChanges,
        List<Dependency> dependencies) {

    public record Dependency(String from, String to) {
    }

    public WoodAnalysisInput {
        calculationSteps = ScenarioLists.compact(calculationSteps);
        variables = ScenarioLists.compact(variables);
        dependencies = ScenarioLists.compact(dependencies);
    }

    public static WoodAnalysisInput ofContent(String content) {
        return WoodAnalysisInput.builder().content(content).build();
    }
}
