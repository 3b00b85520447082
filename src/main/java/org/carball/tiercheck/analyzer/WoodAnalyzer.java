package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.model.metrics.CoordinativeComplexity;
import org.carball.tiercheck.model.metrics.DynamicComplexity;
import org.carball.tiercheck.model.metrics.WoodMetrics;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Wood (1986) task complexity: component complexity (acts and information cues),
 * coordinative complexity (how acts depend on each other) and dynamic complexity (how inputs change).
 */
@Slf4j
public class WoodAnalyzer implements FrameworkAnalyzer<WoodAnalysisInput, WoodMetrics> {

    static final String RULES_VERSION = "1";

    static final int MIN_DISTINCT_ACTS = 2;
    static final int MAX_DISTINCT_ACTS = 15;
    private static final double BULLET_ACT_FACTOR = 0.7;

    // Score contributions
    private static final double ACT_WEIGHT = 0.5;
    private static final int ACT_CAP = 10;
    private static final double CUE_WEIGHT = 1.0;
    private static final int CUE_CAP = 5;

    private static final Pattern CALCULATION_VERBS = Pattern.compile(
            "\\b(?:" + String.join("|", Arrays.asList(
                    "calculate", "compute", "determine", "analyze", "evaluate", "assess", "compare",
                    "measure", "estimate", "derive", "solve", "find", "identify", "classify", "rank",
                    "prioritize", "allocate", "optimize", "balance", "reconcile")) + ")\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_ITEM = Pattern.compile("(?:^|\\n)\\s*\\d+[.)]\\s+");
    private static final Pattern BULLET_ITEM = Pattern.compile("(?:^|\\n)\\s*[-•*]\\s+");

    static final RuleTable INFORMATION_CUES = RuleTable.ofPatterns("wood.informationCues", RULES_VERSION,
            "\\$[\\d,]+(?:\\.\\d{2})?",
            "\\d+(?:\\.\\d+)?%",
            "\\d+(?:\\.\\d+)?\\s*(?:years?|months?|days?|hours?)",
            "\\d+(?:,\\d{3})*(?:\\.\\d+)?",
            "ratio|rate|percentage|proportion|factor|coefficient",
            "revenue|cost|expense|profit|margin|income|tax|interest",
            "inventory|stock|units?|quantity|amount|balance",
            "price|value|worth|premium|discount");

    static final RuleTable SEQUENTIAL = RuleTable.ofPatterns("wood.sequential", RULES_VERSION,
            "first[\\s,]+.*then",
            "step\\s*\\d+",
            "after\\s+(?:calculating|determining|finding)",
            "once\\s+(?:you|we)\\s+have",
            "using\\s+(?:the|this)\\s+result",
            "based\\s+on\\s+(?:the|this)\\s+calculation");

    static final RuleTable INTERDEPENDENT = RuleTable.ofPatterns("wood.interdependent", RULES_VERSION,
            "depends?\\s+on",
            "affects?\\s+(?:the|this)",
            "influences?\\s+(?:the|this)",
            "interrelated",
            "simultaneously",
            "together\\s+with",
            "in\\s+conjunction\\s+with",
            "mutual(?:ly)?");

    static final RuleTable NETWORKED = RuleTable.ofPatterns("wood.networked", RULES_VERSION,
            "feedback\\s+loop",
            "circular\\s+dependency",
            "iterative(?:ly)?",
            "recursive(?:ly)?",
            "cascading\\s+effect",
            "ripple\\s+effect",
            "chain\\s+reaction",
            "interconnected",
            "complex\\s+(?:web|network)");

    static final RuleTable DYNAMIC_LOW = RuleTable.ofPatterns("wood.dynamicLow", RULES_VERSION,
            "may\\s+change",
            "could\\s+vary",
            "potentially\\s+different",
            "slight\\s+variation",
            "minor\\s+adjustment");

    static final RuleTable DYNAMIC_HIGH = RuleTable.ofPatterns("wood.dynamicHigh", RULES_VERSION,
            "constantly\\s+changing",
            "highly\\s+volatile",
            "uncertain\\s+(?:market|conditions?)",
            "unpredictable",
            "rapid\\s+changes?",
            "dynamic\\s+(?:environment|conditions?)",
            "real-time\\s+(?:updates?|changes?)",
            "fluctuat(?:es?|ing)");

    @Override
    public String getName() {
        return "wood";
    }

    @Override
    public WoodMetrics analyze(WoodAnalysisInput input) {
        String content = input.content();

        int distinctActs = countDistinctActs(content, input);
        int informationCues = countInformationCues(content, input);
        double cuesPerAct = round1((double) informationCues / distinctActs);
        int totalElements = distinctActs * (int) Math.ceil(cuesPerAct);

        CoordinativeComplexity coordinative = determineCoordinativeComplexity(content, input);
        DynamicComplexity dynamic = determineDynamicComplexity(content, input.hasStateChanges());

        double componentScore = round1(distinctActs * cuesPerAct * coordinativeMultiplier(coordinative));

        log.debug("Wood analysis: {} acts, {} cues, {} coordination, {} dynamics",
                distinctActs, informationCues, coordinative, dynamic);

        return WoodMetrics.builder()
                .distinctActs(distinctActs)
                .informationCuesPerAct(cuesPerAct)
                .totalElements(totalElements)
                .coordinativeComplexity(coordinative)
                .dynamicComplexity(dynamic)
                .componentComplexityScore(componentScore)
                .build();
    }

    @Override
    public double calculateScore(WoodMetrics metrics) {
        double score = 0;

        // Factor 1: Distinct acts (0-5 points)
        score += Math.min(metrics.distinctActs(), ACT_CAP) * ACT_WEIGHT;

        // Factor 2: Information cues per act (0-5 points)
        score += Math.min(metrics.informationCuesPerAct(), CUE_CAP) * CUE_WEIGHT;

        // Factor 3: Coordination (1-5 points)
        switch (metrics.coordinativeComplexity()) {
            case NETWORKED:
                score += 5;
                break;
            case INTERDEPENDENT:
                score += 3;
                break;
            default:
                score += 1;
        }

        // Factor 4: Dynamics (0-4 points)
        switch (metrics.dynamicComplexity()) {
            case HIGH:
                score += 4;
                break;
            case LOW:
                score += 2;
                break;
            default:
                break;
        }

        return round1(score);
    }

    int countDistinctActs(String content, WoodAnalysisInput input) {
        if (!input.calculationSteps().isEmpty()) {
            return clampActs(input.calculationSteps().size());
        }

        int verbs = count(CALCULATION_VERBS, content);
        int numbered = count(NUMBERED_ITEM, content);
        int bullets = (int) Math.ceil(count(BULLET_ITEM, content) * BULLET_ACT_FACTOR);

        return clampActs(Math.max(verbs, Math.max(numbered, bullets)));
    }

    int countInformationCues(String content, WoodAnalysisInput input) {
        if (!input.variables().isEmpty()) {
            return input.variables().size();
        }
        return Math.max(1, INFORMATION_CUES.distinctMatches(content).size());
    }

    CoordinativeComplexity determineCoordinativeComplexity(String content, WoodAnalysisInput input) {
        if (!input.dependencies().isEmpty()) {
            DependencyGraph graph = DependencyGraph.empty();
            input.dependencies().forEach(d -> graph.addEdge(d.from(), d.to()));

            if (graph.hasCycle()) {
                return CoordinativeComplexity.NETWORKED;
            }
            if (graph.maxInDegree() >= 2) {
                return CoordinativeComplexity.INTERDEPENDENT;
            }
        }

        int networked = NETWORKED.countMatchingRules(content);
        int interdependent = INTERDEPENDENT.countMatchingRules(content);
        int sequential = SEQUENTIAL.countMatchingRules(content);

        if (Boolean.TRUE.equals(input.hasConditionals())) {
            interdependent += 2;
        }

        if (networked >= 2) {
            return CoordinativeComplexity.NETWORKED;
        }
        if (interdependent >= 2 || (interdependent >= 1 && sequential >= 1)) {
            return CoordinativeComplexity.INTERDEPENDENT;
        }
        return CoordinativeComplexity.SEQUENTIAL;
    }

    DynamicComplexity determineDynamicComplexity(String content, Boolean hasStateChanges) {
        if (Boolean.FALSE.equals(hasStateChanges)) {
            return DynamicComplexity.STATIC;
        }

        int high = DYNAMIC_HIGH.countMatchingRules(content);
        if (high >= 2 || Boolean.TRUE.equals(hasStateChanges)) {
            return DynamicComplexity.HIGH;
        }

        int low = DYNAMIC_LOW.countMatchingRules(content);
        if (low >= 1 || high >= 1) {
            return DynamicComplexity.LOW;
        }
        return DynamicComplexity.STATIC;
    }

    private static double coordinativeMultiplier(CoordinativeComplexity coordinative) {
        switch (coordinative) {
            case NETWORKED:
                return 1.5;
            case INTERDEPENDENT:
                return 1.2;
            default:
                return 1.0;
        }
    }

    private static int clampActs(int acts) {
        return Math.max(MIN_DISTINCT_ACTS, Math.min(MAX_DISTINCT_ACTS, acts));
    }

    private static int count(Pattern pattern, String content) {
        var matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
