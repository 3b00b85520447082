package org.carball.tiercheck.analyzer;

import lombok.Builder;
import org.carball.tiercheck.model.scenario.Relationship;
import org.carball.tiercheck.model.scenario.ScenarioLists;
import org.carball.tiercheck.model.scenario.ScenarioVariable;

import java.util.List;

/**
 * Input for {@link LiuLiAnalyzer}. Explicit values take precedence over structured lists, which take
 * precedence over what the text suggests.
 */
@Builder
public record LiuLiAnalysisInput(
        String content,
        Integer entityCount,
        List<String> entityTypes,
        List<ScenarioVariable> variables,
        List<String> ambiguousRequirements,
        List<Relationship> relationships,
        Boolean involvesChangingState,
        List<String> missingInformation,
        List<String> conflictingRequirements,
        Boolean isNovel,
        String domain,
        String timeConstraints,
        List<WeightedStep> calculationSteps) {

    /**
     * A calculation step with an optional cognitive weight; unweighted steps count as 2.
     */
    public record WeightedStep(String step, Integer weight) {
    }

    public LiuLiAnalysisInput {
        entityTypes = ScenarioLists.compact(entityTypes);
        variables = ScenarioLists.compact(variables);
        ambiguousRequirements = ScenarioLists.compact(ambiguousRequirements);
        relationships = ScenarioLists.compact(relationships);
        missingInformation = ScenarioLists.compact(missingInformation);
        conflictingRequirements = ScenarioLists.compact(conflictingRequirements);
        calculationSteps = ScenarioLists.compact(calculationSteps);
    }

    public static LiuLiAnalysisInput ofContent(String content) {
        return LiuLiAnalysisInput.builder().content(content).build();
    }
}
