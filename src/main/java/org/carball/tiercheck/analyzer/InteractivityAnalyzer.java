package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.scenario.ScenarioVariable;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Element interactivity from cognitive load theory: how many elements must be held in working memory at once.
 */
@Slf4j
public class InteractivityAnalyzer implements FrameworkAnalyzer<InteractivityInput, ElementInteractivityAnalysis> {

    static final String RULES_VERSION = "1";

    private static final int MIN_ESTIMATED_ELEMENTS = 3;
    private static final int MAX_ESTIMATED_EDGES = 15;
    private static final int MAX_ESTIMATED_DEPTH = 5;

    private static final Pattern NUMBER = PatternRule.compile("\\d+(?:,\\d{3})*(?:\\.\\d+)?");

    static final RuleTable VARIABLE_TERMS = RuleTable.ofPatterns("interactivity.variableTerms", RULES_VERSION,
            "(?:total|sum|average|mean|rate|ratio|percentage|amount|value|cost|revenue|profit)",
            "(?:quantity|units?|inventory|balance|payment|interest)");

    static final RuleTable DEPENDENCY = RuleTable.ofPatterns("interactivity.dependency", RULES_VERSION,
            "(?:using|with)\\s+(?:the|this|these)",
            "(?:based\\s+on|derived\\s+from|calculated\\s+from)",
            "(?:requires?|needs?)\\s+(?:the|this|these)",
            "(?:from\\s+(?:step|calculation|equation))\\s*\\d+",
            "(?:result(?:s|ing)?)\\s+(?:of|from)",
            "(?:input|output|feeds?\\s+into)",
            "(?:combined\\s+with|together\\s+with|along\\s+with)",
            "(?:multiply|divide|add|subtract)\\s+.*\\s+(?:by|from|to)");

    static final RuleTable SIMULTANEOUS = RuleTable.ofPatterns("interactivity.simultaneous", RULES_VERSION,
            "(?:simultaneously|at\\s+the\\s+same\\s+time|concurrently)",
            "(?:all\\s+(?:of\\s+)?(?:the|these)\\s+(?:factors|elements|variables))",
            "(?:consider(?:ing)?\\s+(?:all|multiple|several))",
            "(?:balancing?|weighing?)\\s+(?:multiple|several|all)",
            "(?:integrat(?:e|ing)\\s+(?:all|multiple|these))",
            "(?:combined|aggregate|composite|overall)",
            "(?:taking\\s+into\\s+account|accounting\\s+for)");

    private final CycleBreakPolicy cycleBreakPolicy;

    public InteractivityAnalyzer() {
        this(CycleBreakPolicy.COUNT_BACK_EDGE_AS_LEAF);
    }

    public InteractivityAnalyzer(CycleBreakPolicy cycleBreakPolicy) {
        this.cycleBreakPolicy = cycleBreakPolicy;
    }

    @Override
    public String getName() {
        return "interactivity";
    }

    @Override
    public ElementInteractivityAnalysis analyze(InteractivityInput input) {
        String content = input.content();

        int totalElements = determineTotalElements(input);
        DependencyGraph graph = buildGraph(input);

        int edges;
        int depth;
        if (graph.isEmpty()) {
            int indicators = DEPENDENCY.countOccurrences(content);
            edges = Math.min(indicators, MAX_ESTIMATED_EDGES);
            depth = Math.min((int) Math.ceil(indicators / 3.0), MAX_ESTIMATED_DEPTH);
        } else {
            edges = countDeclaredEdges(input);
            depth = graph.longestPathDepth(cycleBreakPolicy);
        }

        int simultaneous = calculateSimultaneousElements(content, totalElements, graph, depth);
        double ratio = totalElements > 0 ? Math.min(simultaneous / (double) totalElements, 1) : 0;

        ElementInteractivityAnalysis analysis = ElementInteractivityAnalysis.builder()
                .totalElements(totalElements)
                .simultaneousElements(simultaneous)
                .interactivityRatio(ratio)
                .dependencyDepth(depth)
                .dependencyEdges(edges)
                .build();

        log.debug("Element interactivity analysis: {}", analysis);
        return analysis;
    }

    @Override
    public double calculateScore(ElementInteractivityAnalysis analysis) {
        double score = analysis.interactivityRatio() * 10;
        score += Math.min(analysis.dependencyDepth(), 5) * 0.6;
        score += Math.min(analysis.dependencyEdges(), 10) * 0.2;
        return WoodAnalyzer.round1(score);
    }

    int determineTotalElements(InteractivityInput input) {
        if (input.totalElements() != null) {
            return input.totalElements();
        }
        if (input.woodTotalElements() != null) {
            return input.woodTotalElements();
        }
        if (!input.variables().isEmpty()) {
            return input.variables().size();
        }
        if (!input.steps().isEmpty()) {
            Set<String> elements = new HashSet<>();
            for (InteractivityInput.StepNode step : input.steps()) {
                elements.add(step.id());
                elements.addAll(step.dependsOn());
                elements.addAll(step.produces());
            }
            return elements.size();
        }
        return estimateElementsFromContent(input.content());
    }

    int estimateElementsFromContent(String content) {
        Set<String> numbers = new LinkedHashSet<>();
        NUMBER.matcher(content).results().forEach(m -> numbers.add(m.group()));

        int variableCount = 0;
        for (PatternRule rule : VARIABLE_TERMS.getRules()) {
            variableCount += (int) rule.results(content)
                    .map(m -> m.group().toLowerCase(Locale.ROOT))
                    .distinct()
                    .count();
        }

        return Math.max(numbers.size() + variableCount, MIN_ESTIMATED_ELEMENTS);
    }

    private DependencyGraph buildGraph(InteractivityInput input) {
        DependencyGraph graph = DependencyGraph.empty();
        for (ScenarioVariable variable : input.variables()) {
            if (!variable.dependsOn().isEmpty()) {
                graph.putNode(variable.name(), variable.dependsOn());
            }
        }
        for (InteractivityInput.StepNode step : input.steps()) {
            if (!step.dependsOn().isEmpty()) {
                graph.putNode(step.id(), step.dependsOn());
            }
        }
        return graph;
    }

    /**
     * Counts every declared dependency, including those of a step that shares its id with a variable.
     */
    int countDeclaredEdges(InteractivityInput input) {
        int edges = 0;
        for (ScenarioVariable variable : input.variables()) {
            edges += variable.dependsOn().size();
        }
        for (InteractivityInput.StepNode step : input.steps()) {
            edges += step.dependsOn().size();
        }
        return edges;
    }

    private int calculateSimultaneousElements(String content, int totalElements, DependencyGraph graph, int depth) {
        int indicators = SIMULTANEOUS.countOccurrences(content);

        if (!graph.isEmpty()) {
            return Math.max(graph.maxOutDegree() + 1, (int) Math.ceil(indicators * 1.5));
        }
        if (indicators >= 3) {
            return (int) Math.ceil(totalElements * 0.7);
        }
        if (indicators >= 1) {
            return (int) Math.ceil(totalElements * 0.4);
        }

        double depthFactor = depth / 5.0;
        return Math.max(2, (int) Math.ceil(totalElements * Math.min(depthFactor, 0.5)));
    }
}
