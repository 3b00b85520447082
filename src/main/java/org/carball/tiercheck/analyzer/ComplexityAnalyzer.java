package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.model.metrics.CampbellAttributes;
import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.metrics.LiuLiDimensions;
import org.carball.tiercheck.model.metrics.WoodMetrics;
import org.carball.tiercheck.model.scenario.ScenarioHints;
import org.carball.tiercheck.model.scenario.ScenarioInput;
import org.carball.tiercheck.model.scenario.ScenarioVariable;
import org.carball.tiercheck.model.scoring.ComplexityScore;
import org.carball.tiercheck.model.scoring.Tier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs the four framework analyzers over one scenario and scores the result.
 */
@Slf4j
public class ComplexityAnalyzer {

    private final WoodAnalyzer woodAnalyzer;
    private final CampbellAnalyzer campbellAnalyzer;
    private final LiuLiAnalyzer liuLiAnalyzer;
    private final InteractivityAnalyzer interactivityAnalyzer;
    private final CompositeScorer scorer;

    public ComplexityAnalyzer() {
        this(CycleBreakPolicy.COUNT_BACK_EDGE_AS_LEAF);
    }

    public ComplexityAnalyzer(CycleBreakPolicy cycleBreakPolicy) {
        this.woodAnalyzer = new WoodAnalyzer();
        this.campbellAnalyzer = new CampbellAnalyzer();
        this.liuLiAnalyzer = new LiuLiAnalyzer();
        this.interactivityAnalyzer = new InteractivityAnalyzer(cycleBreakPolicy);
        this.scorer = new CompositeScorer(woodAnalyzer, campbellAnalyzer, liuLiAnalyzer, interactivityAnalyzer);
    }

    /**
     * Single-shot analysis of raw text. An analyzer failure yields the zero-valued error score.
     */
    public ComplexityScore analyzeComplexity(String content, Tier intendedTier, ScenarioHints hints,
                                             ComplexityValidationConfig config) {
        ScenarioInput scenario = ScenarioInput.of(null, intendedTier, content, hints);
        AnalyzerResult<ComplexityScore> result = analyze(scenario, config);
        if (result instanceof AnalyzerResult.Err<ComplexityScore> err) {
            return CompositeScorer.errorScore(intendedTier, err.analyzer() + ": " + err.reason());
        }
        return result.orElseThrow();
    }

    public AnalyzerResult<ComplexityScore> analyze(ScenarioInput scenario, ComplexityValidationConfig config) {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(scenario.intendedTier(), "intendedTier");
        Objects.requireNonNull(config, "config");

        String content = scenario.content();
        if (content == null) {
            return AnalyzerResult.err("input", "Scenario content is missing");
        }

        AnalyzerResult<WoodMetrics> wood = woodAnalyzer.tryAnalyze(woodInput(scenario));
        if (wood instanceof AnalyzerResult.Err<WoodMetrics> err) {
            return failed(err);
        }
        AnalyzerResult<CampbellAttributes> campbell = campbellAnalyzer.tryAnalyze(campbellInput(content));
        if (campbell instanceof AnalyzerResult.Err<CampbellAttributes> err) {
            return failed(err);
        }
        AnalyzerResult<LiuLiDimensions> liuLi = liuLiAnalyzer.tryAnalyze(liuLiInput(scenario));
        if (liuLi instanceof AnalyzerResult.Err<LiuLiDimensions> err) {
            return failed(err);
        }

        WoodMetrics woodMetrics = wood.orElseThrow();
        AnalyzerResult<ElementInteractivityAnalysis> interactivity =
                interactivityAnalyzer.tryAnalyze(interactivityInput(scenario, woodMetrics.totalElements()));
        if (interactivity instanceof AnalyzerResult.Err<ElementInteractivityAnalysis> err) {
            return failed(err);
        }

        return AnalyzerResult.capture("compositeScorer", () -> scorer.calculateCompositeScore(
                scenario.intendedTier(),
                woodMetrics,
                campbell.orElseThrow(),
                liuLi.orElseThrow(),
                interactivity.orElseThrow(),
                config));
    }

    static WoodAnalysisInput woodInput(ScenarioInput scenario) {
        String content = scenario.content();
        return WoodAnalysisInput.builder()
                .content(content)
                .calculationSteps(scenario.calculationSteps())
                .variables(scenario.variables().stream().map(ScenarioVariable::name).collect(Collectors.toList()))
                .hasConditionals(ScenarioTextExtractor.hasConditionals(content))
                .hasStateChanges(ScenarioTextExtractor.hasStateChanges(content))
                .dependencies(scenario.relationships().stream()
                        .map(r -> new WoodAnalysisInput.Dependency(r.from(), r.to()))
                        .collect(Collectors.toList()))
                .build();
    }

    static CampbellAnalysisInput campbellInput(String content) {
        return CampbellAnalysisInput.builder()
                .content(content)
                .solutionApproaches(ScenarioTextExtractor.extractApproaches(content))
                .objectives(ScenarioTextExtractor.extractObjectives(content))
                .tradeoffs(ScenarioTextExtractor.extractTradeoffs(content))
                .informationGaps(ScenarioTextExtractor.extractInformationGaps(content))
                .build();
    }

    static LiuLiAnalysisInput liuLiInput(ScenarioInput scenario) {
        List<ScenarioVariable> variables = scenario.variables();
        return LiuLiAnalysisInput.builder()
                .content(scenario.content())
                .entityCount(variables.isEmpty() ? null : variables.size())
                .entityTypes(variables.stream()
                        .map(ScenarioVariable::type)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList()))
                .variables(variables)
                .relationships(scenario.relationships())
                .domain(scenario.domain())
                .calculationSteps(scenario.calculationSteps().stream()
                        .map(step -> new LiuLiAnalysisInput.WeightedStep(step, null))
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * Explicit steps are treated as a chain: each step depends on the one before it.
     */
    static InteractivityInput interactivityInput(ScenarioInput scenario, int woodTotalElements) {
        List<InteractivityInput.StepNode> steps = new ArrayList<>();
        for (int i = 1; i <= scenario.calculationSteps().size(); i++) {
            List<String> dependsOn = i > 1 ? List.of("step-" + (i - 1)) : List.of();
            steps.add(new InteractivityInput.StepNode("step-" + i, dependsOn, List.of()));
        }
        return InteractivityInput.builder()
                .content(scenario.content())
                .woodTotalElements(woodTotalElements)
                .variables(scenario.variables())
                .steps(steps)
                .build();
    }

    private static <T> AnalyzerResult<ComplexityScore> failed(AnalyzerResult.Err<T> err) {
        log.warn("Analyzer {} failed: {}", err.analyzer(), err.reason());
        return AnalyzerResult.err(err.analyzer(), err.reason());
    }
}
