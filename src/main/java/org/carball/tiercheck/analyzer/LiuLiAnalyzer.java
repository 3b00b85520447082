package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.model.metrics.LiuLiDimensions;
import org.carball.tiercheck.model.metrics.NoveltyLevel;
import org.carball.tiercheck.model.metrics.TimePressure;
import org.carball.tiercheck.model.scenario.ScenarioVariable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Liu &amp; Li (2012) ten-dimension task complexity.
 */
@Slf4j
public class LiuLiAnalyzer implements FrameworkAnalyzer<LiuLiAnalysisInput, LiuLiDimensions> {

    static final String RULES_VERSION = "1";

    private static final int MIN_SIZE = 3;
    private static final int VARIETY_CATEGORIES = 5;
    private static final int DEFAULT_STEP_WEIGHT = 2;
    private static final int DEFAULT_POSSIBLE_RELATIONSHIPS = 10;
    private static final int SEMI_FAMILIAR_LENGTH = 2000;

    private static final double LOW_MATCH_WEIGHT = 0.1;
    private static final double HIGH_MATCH_WEIGHT = 0.15;
    private static final double CHANGING_STATE_VARIABILITY = 0.7;
    private static final double STATIC_STATE_VARIABILITY = 0.1;
    private static final double LISTED_ITEM_WEIGHT = 0.2;

    static final RuleTable SIZE_TOKENS = RuleTable.ofPatterns("liuLi.size", RULES_VERSION,
            "\\d+(?:,\\d{3})*(?:\\.\\d+)?",
            "\\d+(?:\\.\\d+)?%",
            "\\$[\\d,]+(?:\\.\\d{2})?");

    static final RuleTable VARIETY = RuleTable.of("liuLi.variety", RULES_VERSION,
            PatternRule.inCategory("financial", "financial.core", "(?:revenue|cost|expense|profit|margin|income|tax)"),
            PatternRule.inCategory("financial", "financial.capital", "(?:interest|depreciation|amortization|investment)"),
            PatternRule.inCategory("financial", "financial.metrics", "(?:cash\\s*flow|NPV|IRR|ROI|WACC)"),
            PatternRule.inCategory("financial", "financial.planning", "(?:budget|forecast|variance)"),
            PatternRule.inCategory("accounting", "accounting.books", "(?:journal\\s*entry|ledger|balance\\s*sheet)"),
            PatternRule.inCategory("accounting", "accounting.accounts", "(?:debit|credit|accounts?\\s*(?:receivable|payable))"),
            PatternRule.inCategory("accounting", "accounting.inventory", "(?:inventory|FIFO|LIFO|weighted\\s*average)"),
            PatternRule.inCategory("accounting", "accounting.timing", "(?:accrual|deferral|prepaid)"),
            PatternRule.inCategory("statistical", "statistical.descriptive", "(?:mean|median|mode|standard\\s*deviation|variance)"),
            PatternRule.inCategory("statistical", "statistical.inference", "(?:regression|correlation|hypothesis|significance)"),
            PatternRule.inCategory("statistical", "statistical.tests", "(?:confidence\\s*interval|p-value|t-test|ANOVA)"),
            PatternRule.inCategory("statistical", "statistical.sampling", "(?:distribution|probability|sample\\s*size)"),
            PatternRule.inCategory("operational", "operational.capacity", "(?:capacity|throughput|utilization|efficiency)"),
            PatternRule.inCategory("operational", "operational.flow", "(?:lead\\s*time|cycle\\s*time|bottleneck)"),
            PatternRule.inCategory("operational", "operational.stock", "(?:EOQ|reorder\\s*point|safety\\s*stock)"),
            PatternRule.inCategory("operational", "operational.planning", "(?:scheduling|routing|sequencing)"),
            PatternRule.inCategory("valuation", "valuation.basis", "(?:fair\\s*value|book\\s*value|market\\s*value)"),
            PatternRule.inCategory("valuation", "valuation.discounting", "(?:discount(?:ed)?|present\\s*value|future\\s*value)"),
            PatternRule.inCategory("valuation", "valuation.comparables", "(?:multiple|comparable|ratio\\s*analysis)"));

    static final RuleTable AMBIGUITY = RuleTable.weighted("liuLi.ambiguity", RULES_VERSION, LOW_MATCH_WEIGHT,
            "(?:unclear|ambiguous|vague|unspecified)",
            "(?:assume|assuming|assumption)",
            "(?:may|might|could)\\s+(?:be|mean|require)",
            "(?:not\\s+specified|no\\s+information)",
            "(?:interpret|interpretation)",
            "(?:depends\\s+on|depending\\s+on)",
            "what\\s+(?:if|should|does)",
            "(?:either|or)\\s+.*(?:or)",
            "(?:professional\\s+judgment|management\\s+discretion)");

    static final RuleTable RELATIONSHIPS = RuleTable.weighted("liuLi.relationships", RULES_VERSION, HIGH_MATCH_WEIGHT,
            "(?:depends\\s+on|affects?|influences?|impacts?)",
            "(?:related\\s+to|connected\\s+to|linked\\s+to)",
            "(?:based\\s+on|derived\\s+from|calculated\\s+from)",
            "(?:determines|drives|leads\\s+to)",
            "(?:input|output|feeds?\\s+into)",
            "(?:interacts?\\s+with|correlates?\\s+with)");

    static final RuleTable VARIABILITY = RuleTable.weighted("liuLi.variability", RULES_VERSION, LOW_MATCH_WEIGHT,
            "(?:changes?|changing|changed)\\s+(?:in|to|from)",
            "(?:fluctuat|vari(?:es|able|ation)|volatil)",
            "(?:adjust(?:ed|ment)|revision|update)",
            "(?:dynamic|evolving|shifting)",
            "(?:over\\s+time|period\\s+to\\s+period|year\\s+over\\s+year)",
            "(?:increase|decrease|grow|decline|rise|fall)",
            "(?:trend|pattern|cycle|seasonal)");

    static final RuleTable UNRELIABILITY = RuleTable.weighted("liuLi.unreliability", RULES_VERSION, LOW_MATCH_WEIGHT,
            "(?:estimat|approximat|rough)",
            "(?:uncertain|unreliable|inconsistent)",
            "(?:incomplete|missing|unavailable)\\s+(?:data|information)",
            "(?:conflicting|contradictory)\\s+(?:data|information|reports)",
            "(?:forecast|project|predict)",
            "(?:subject\\s+to\\s+(?:error|change|revision))",
            "(?:preliminary|tentative|provisional)");

    static final RuleTable NOVELTY_ROUTINE = RuleTable.ofPatterns("liuLi.noveltyRoutine", RULES_VERSION,
            "(?:standard|typical|common|usual|regular)",
            "(?:routine|straightforward|basic)",
            "(?:following|according\\s+to)\\s+(?:standard|established)");

    static final RuleTable NOVELTY_SEMI_FAMILIAR = RuleTable.ofPatterns("liuLi.noveltySemiFamiliar", RULES_VERSION,
            "(?:slightly|somewhat)\\s+(?:different|unusual|complex)",
            "(?:variation|modification)\\s+of",
            "(?:similar\\s+to|like)\\s+.*(?:but|with)",
            "(?:new|updated)\\s+(?:regulation|standard|requirement)");

    static final RuleTable NOVELTY_NOVEL = RuleTable.ofPatterns("liuLi.noveltyNovel", RULES_VERSION,
            "(?:unprecedented|unusual|unique|rare|first-time)",
            "(?:never\\s+(?:before|seen|encountered))",
            "(?:emerging|innovative|cutting-edge|novel)",
            "(?:complex\\s+(?:scenario|situation|case))",
            "(?:no\\s+(?:precedent|prior|established)\\s+(?:guidance|framework))");

    static final RuleTable INCONGRUITY = RuleTable.weighted("liuLi.incongruity", RULES_VERSION, HIGH_MATCH_WEIGHT,
            "(?:conflict(?:ing)?|contradict(?:ory|ing)?)",
            "(?:inconsisten(?:t|cy))",
            "(?:competing|opposing)\\s+(?:interests?|goals?|objectives?)",
            "(?:trade-?off|dilemma)",
            "(?:however|but|although|nevertheless|yet),?\\s+(?:also|simultaneously)",
            "(?:on\\s+(?:one|the\\s+other)\\s+hand)",
            "(?:balance\\s+(?:between|among))");

    static final RuleTable ACTION_VERBS = RuleTable.of("liuLi.actionVerbs", RULES_VERSION,
            verb("identify", 1), verb("list", 1), verb("describe", 1),
            verb("calculate", 2), verb("compute", 2), verb("determine", 2), verb("compare", 2),
            verb("analyze", 3), verb("evaluate", 3), verb("assess", 3),
            verb("synthesize", 4), verb("integrate", 4), verb("optimize", 4),
            verb("recommend", 3), verb("justify", 3), verb("critique", 3),
            verb("design", 4), verb("develop", 4), verb("create", 4));

    static final RuleTable TIME_HIGH = RuleTable.ofPatterns("liuLi.timeHigh", RULES_VERSION,
            "(?:urgent(?:ly)?|ASAP|immediately)",
            "(?:critical\\s+deadline|time-sensitive)",
            "(?:today|tomorrow|by\\s+COB|end\\s+of\\s+day)",
            "(?:real-time|on-demand|instant)",
            "(?:rush|expedite|prioritize)");

    static final RuleTable TIME_MODERATE = RuleTable.ofPatterns("liuLi.timeModerate", RULES_VERSION,
            "(?:deadline|due\\s+(?:date|by))",
            "(?:by\\s+(?:end\\s+of|close\\s+of))",
            "(?:within\\s+\\d+\\s+(?:days?|weeks?|months?))",
            "(?:quarterly|monthly|weekly)\\s+(?:report|deadline)");

    private static final Pattern URGENT_CONSTRAINT = PatternRule.compile("urgent|asap|immediate|today|critical");
    private static final Pattern DEADLINE_CONSTRAINT = PatternRule.compile("deadline|due|within");

    @Override
    public String getName() {
        return "liuLi";
    }

    @Override
    public LiuLiDimensions analyze(LiuLiAnalysisInput input) {
        String content = input.content();

        LiuLiDimensions dimensions = LiuLiDimensions.builder()
                .size(calculateSize(content, input))
                .variety(calculateVariety(content, input))
                .ambiguity(listedOrPatterns(input.ambiguousRequirements().size() / (double) VARIETY_CATEGORIES,
                        input.ambiguousRequirements().isEmpty(), AMBIGUITY, content))
                .relationships(calculateRelationships(content, input))
                .variability(calculateVariability(content, input.involvesChangingState()))
                .unreliability(listedOrPatterns(input.missingInformation().size() * LISTED_ITEM_WEIGHT,
                        input.missingInformation().isEmpty(), UNRELIABILITY, content))
                .novelty(determineNovelty(content, input.isNovel()))
                .incongruity(listedOrPatterns(input.conflictingRequirements().size() * LISTED_ITEM_WEIGHT,
                        input.conflictingRequirements().isEmpty(), INCONGRUITY, content))
                .actionComplexity(calculateActionComplexity(content, input.calculationSteps()))
                .timePressure(determineTimePressure(content, input.timeConstraints()))
                .build();

        log.debug("Liu & Li analysis: {}", dimensions);
        return dimensions;
    }

    @Override
    public double calculateScore(LiuLiDimensions dimensions) {
        double score = 0;

        score += Math.min(dimensions.size(), 20) * 0.25;
        score += dimensions.variety() * 5;
        score += dimensions.ambiguity() * 5;
        score += dimensions.relationships() * 5;
        score += dimensions.variability() * 3;
        score += dimensions.unreliability() * 4;

        switch (dimensions.novelty()) {
            case NOVEL:
                score += 4;
                break;
            case SEMI_FAMILIAR:
                score += 2;
                break;
            default:
                break;
        }

        score += dimensions.incongruity() * 4;
        score += Math.min(dimensions.actionComplexity(), 20) * 0.25;

        switch (dimensions.timePressure()) {
            case HIGH:
                score += 2;
                break;
            case MODERATE:
                score += 1;
                break;
            default:
                break;
        }

        return WoodAnalyzer.round1(score);
    }

    int calculateSize(String content, LiuLiAnalysisInput input) {
        if (input.entityCount() != null) {
            return input.entityCount();
        }
        if (!input.variables().isEmpty()) {
            return input.variables().size();
        }

        Set<String> tokens = new LinkedHashSet<>();
        for (PatternRule rule : SIZE_TOKENS.getRules()) {
            rule.results(content).forEach(m -> tokens.add(m.group()));
        }
        return Math.max(tokens.size(), MIN_SIZE);
    }

    double calculateVariety(String content, LiuLiAnalysisInput input) {
        if (!input.entityTypes().isEmpty()) {
            return Math.min(new LinkedHashSet<>(input.entityTypes()).size() / (double) VARIETY_CATEGORIES, 1);
        }
        if (!input.variables().isEmpty()) {
            long types = input.variables().stream()
                    .map(ScenarioVariable::type)
                    .filter(Objects::nonNull)
                    .map(t -> t.toLowerCase(Locale.ROOT))
                    .distinct()
                    .count();
            return Math.min(types / (double) VARIETY_CATEGORIES, 1);
        }
        return Math.min(VARIETY.countMatchingCategories(content) / (double) VARIETY_CATEGORIES, 1);
    }

    double calculateRelationships(String content, LiuLiAnalysisInput input) {
        int explicit = input.relationships().size();
        if (explicit > 0) {
            Integer entities = input.entityCount();
            double possible = entities != null && entities > 0
                    ? entities * (entities - 1) / 2.0
                    : DEFAULT_POSSIBLE_RELATIONSHIPS;
            return possible > 0 ? Math.min(explicit / possible, 1) : 1;
        }
        return Math.min(RELATIONSHIPS.weightedOccurrences(content), 1);
    }

    double calculateVariability(String content, Boolean involvesChangingState) {
        if (Boolean.TRUE.equals(involvesChangingState)) {
            return CHANGING_STATE_VARIABILITY;
        }
        if (Boolean.FALSE.equals(involvesChangingState)) {
            return STATIC_STATE_VARIABILITY;
        }
        return Math.min(VARIABILITY.weightedOccurrences(content), 1);
    }

    NoveltyLevel determineNovelty(String content, Boolean isNovel) {
        if (isNovel != null) {
            return isNovel ? NoveltyLevel.NOVEL : NoveltyLevel.ROUTINE;
        }

        if (NOVELTY_NOVEL.countMatchingRules(content) >= 2) {
            return NoveltyLevel.NOVEL;
        }
        if (NOVELTY_SEMI_FAMILIAR.countMatchingRules(content) >= 2) {
            return NoveltyLevel.SEMI_FAMILIAR;
        }
        if (NOVELTY_ROUTINE.countMatchingRules(content) >= 1) {
            return NoveltyLevel.ROUTINE;
        }
        return content.length() > SEMI_FAMILIAR_LENGTH ? NoveltyLevel.SEMI_FAMILIAR : NoveltyLevel.ROUTINE;
    }

    int calculateActionComplexity(String content, List<LiuLiAnalysisInput.WeightedStep> steps) {
        if (!steps.isEmpty()) {
            return steps.stream()
                    .mapToInt(s -> s.weight() != null && s.weight() > 0 ? s.weight() : DEFAULT_STEP_WEIGHT)
                    .sum();
        }
        return (int) ACTION_VERBS.weightedOccurrences(content);
    }

    TimePressure determineTimePressure(String content, String timeConstraints) {
        if (timeConstraints != null && !timeConstraints.isBlank()) {
            if (URGENT_CONSTRAINT.matcher(timeConstraints).find()) {
                return TimePressure.HIGH;
            }
            if (DEADLINE_CONSTRAINT.matcher(timeConstraints).find()) {
                return TimePressure.MODERATE;
            }
        }

        if (TIME_HIGH.anyMatch(content)) {
            return TimePressure.HIGH;
        }
        if (TIME_MODERATE.anyMatch(content)) {
            return TimePressure.MODERATE;
        }
        return TimePressure.LOW;
    }

    private static double listedOrPatterns(double listedValue, boolean listEmpty, RuleTable table, String content) {
        if (!listEmpty) {
            return Math.min(listedValue, 1);
        }
        return Math.min(table.weightedOccurrences(content), 1);
    }

    private static PatternRule verb(String verb, int weight) {
        return PatternRule.of(verb, "\\b" + verb + "\\b").withWeight(weight);
    }
}
