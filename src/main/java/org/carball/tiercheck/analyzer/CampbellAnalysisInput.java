package org.carball.tiercheck.analyzer;

import lombok.Builder;
import org.carball.tiercheck.model.scenario.ScenarioLists;

import java.util.List;

/**
 * Input for {@link CampbellAnalyzer}. Each attribute resolves by explicit flag, then explicit list, then text.
 */
@Builder
public record CampbellAnalysisInput(
        String content,
        List<String> solutionApproaches,
        List<String> objectives,
        List<String> tradeoffs,
        List<String> informationGaps,
        Boolean hasMultiplePaths,
        Boolean hasMultipleOutcomes,
        Boolean hasConflicts,
        Boolean hasUncertainty) {

    public CampbellAnalysisInput {
        solutionApproaches = ScenarioLists.compact(solutionApproaches);
        objectives = ScenarioLists.compact(objectives);
        tradeoffs = ScenarioLists.compact(tradeoffs);
        informationGaps = ScenarioLists.compact(informationGaps);
    }

    public static CampbellAnalysisInput ofContent(String content) {
        return CampbellAnalysisInput.builder().content(content).build();
    }
}
