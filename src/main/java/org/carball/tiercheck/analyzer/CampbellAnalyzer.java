package org.carball.tiercheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.model.metrics.CampbellAttributes;
import org.carball.tiercheck.model.metrics.UncertaintyLevel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Campbell (1988) task complexity: multiple paths, multiple outcomes, conflicting
 * interdependence and uncertainty, combined into one of 16 task types.
 */
@Slf4j
public class CampbellAnalyzer implements FrameworkAnalyzer<CampbellAnalysisInput, CampbellAttributes> {

    static final String RULES_VERSION = "1";

    static final int MAX_CONFLICTS = 5;
    private static final int MATCHES_PER_CONFLICT_RULE = 3;
    private static final int CONTEXT_BEFORE = 30;
    private static final int CONTEXT_AFTER = 50;
    private static final int MAX_EXPLICIT_OPTIONS = 5;
    private static final int LIST_LOOKAHEAD = 500;
    private static final String DEFAULT_CONFLICT = "Identified conflict";

    static final RuleTable MULTIPLE_PATHS = RuleTable.ofPatterns("campbell.multiplePaths", RULES_VERSION,
            "(?:several|multiple|various|different)\\s+(?:ways?|methods?|approaches?|options?|alternatives?)",
            "(?:can|could|might)\\s+(?:either|also|alternatively)",
            "option\\s*\\d+",
            "approach\\s*\\d+",
            "method\\s*\\d+",
            "alternatively",
            "on\\s+the\\s+other\\s+hand",
            "(?:one|another)\\s+(?:way|method|approach)",
            "choose\\s+(?:between|among)",
            "(?:first|second|third)\\s+(?:option|approach|method)",
            "versus|vs\\.?|or\\s+alternatively");

    static final RuleTable MULTIPLE_OUTCOMES = RuleTable.ofPatterns("campbell.multipleOutcomes", RULES_VERSION,
            "(?:multiple|several|various|different)\\s+(?:objectives?|goals?|outcomes?|targets?)",
            "(?:maximize|minimize|optimize)\\s+(?:both|all|multiple)",
            "(?:simultaneously|concurrently)\\s+(?:achieve|meet|satisfy)",
            "balance\\s+(?:between|among)",
            "meet\\s+(?:all|both|multiple)\\s+(?:requirements?|criteria|objectives?)",
            "competing\\s+(?:objectives?|goals?|priorities?)",
            "(?:primary|secondary)\\s+(?:objective|goal|outcome)",
            "trade-?off",
            "multi-?objective");

    static final RuleTable CONFLICTS = RuleTable.ofPatterns("campbell.conflicts", RULES_VERSION,
            "conflict(?:ing|s)?(?:\\s+between|\\s+among)?",
            "trade-?off",
            "at\\s+the\\s+expense\\s+of",
            "mutually\\s+exclusive",
            "cannot\\s+(?:both|all)",
            "incompatible",
            "contradictory",
            "tension\\s+between",
            "competing\\s+(?:demands?|priorities?|interests?)",
            "sacrifice\\s+(?:one|some)\\s+(?:for|to)",
            "(?:increase|decrease).*(?:but|however).*(?:decrease|increase)",
            "versus|vs\\.?",
            "either\\s*\\.\\.\\.\\s*or",
            "dilemma");

    static final RuleTable UNCERTAINTY_BOUNDED = RuleTable.ofPatterns("campbell.uncertaintyBounded", RULES_VERSION,
            "(?:may|might|could)\\s+(?:be|vary|change)",
            "uncertain(?:ty)?",
            "unclear",
            "estimated|approximately|roughly|around",
            "range\\s+(?:of|from|between)",
            "between\\s+\\d+\\s+and\\s+\\d+",
            "plus\\s+or\\s+minus",
            "±",
            "(?:best|worst)\\s+case",
            "scenario\\s+(?:analysis|planning)",
            "probability|likelihood",
            "risk\\s+of");

    static final RuleTable UNCERTAINTY_HIGH = RuleTable.ofPatterns("campbell.uncertaintyHigh", RULES_VERSION,
            "highly\\s+uncertain",
            "unknown|unknowable",
            "unpredictable",
            "volatile",
            "significant\\s+(?:uncertainty|risk)",
            "no\\s+(?:clear|definitive|reliable)\\s+(?:data|information)",
            "missing\\s+(?:critical|key|essential)\\s+(?:data|information)",
            "ambiguous",
            "contradictory\\s+(?:data|information|evidence)",
            "insufficient\\s+(?:data|information)",
            "impossible\\s+to\\s+(?:know|determine|predict)");

    private static final Pattern EXPLICIT_OPTION = PatternRule.compile(
            "(?:option|method|approach|alternative)\\s*[a-z1-9]");
    private static final Pattern OBJECTIVE_LIST_START = PatternRule.compile(
            "(?:objectives?|goals?|targets?)\\s*(?:are|include|:|;)");
    private static final Pattern LIST_ITEM = Pattern.compile("(?:^|\\n)\\s*[-•*\\d+.]\\s+");

    @Override
    public String getName() {
        return "campbell";
    }

    @Override
    public CampbellAttributes analyze(CampbellAnalysisInput input) {
        String content = input.content();

        PathAnalysis paths = analyzeMultiplePaths(content, input.solutionApproaches(), input.hasMultiplePaths());
        OutcomeAnalysis outcomes = analyzeMultipleOutcomes(content, input.objectives(), input.hasMultipleOutcomes());
        ConflictAnalysis conflicts = analyzeConflicts(content, input.tradeoffs(), input.hasConflicts());
        UncertaintyAnalysis uncertainty = analyzeUncertainty(content, input.informationGaps(), input.hasUncertainty());

        int campbellType = CampbellAttributes.typeOf(paths.multiplePaths(), outcomes.multipleOutcomes(),
                conflicts.conflicting(), uncertainty.level());

        log.debug("Campbell analysis: type {} ({})", campbellType, CampbellAttributes.describeType(campbellType));

        return CampbellAttributes.builder()
                .multiplePaths(paths.multiplePaths())
                .pathCount(paths.pathCount())
                .multipleOutcomes(outcomes.multipleOutcomes())
                .outcomeCount(outcomes.outcomeCount())
                .conflictingInterdependence(conflicts.conflicting())
                .conflicts(conflicts.conflicts())
                .uncertaintyLevel(uncertainty.level())
                .uncertaintyIndicators(uncertainty.indicators())
                .campbellType(campbellType)
                .build();
    }

    @Override
    public double calculateScore(CampbellAttributes attributes) {
        double score = 0;

        if (attributes.multiplePaths()) {
            score += 3 + Math.min(attributes.pathCount() - 1, 3);
        }

        if (attributes.multipleOutcomes()) {
            score += 3 + Math.min(attributes.outcomeCount() - 1, 3);
        }

        if (attributes.conflictingInterdependence()) {
            score += 4 + Math.min(attributes.conflicts().size(), 3);
        }

        switch (attributes.uncertaintyLevel()) {
            case HIGH:
                score += 5;
                break;
            case BOUNDED:
                score += 3;
                break;
            default:
                break;
        }

        return WoodAnalyzer.round1(score);
    }

    PathAnalysis analyzeMultiplePaths(String content, List<String> approaches, Boolean explicit) {
        int distinctApproaches = distinctCount(approaches);

        if (explicit != null) {
            return new PathAnalysis(explicit, explicit ? Math.max(2, distinctApproaches) : 1);
        }

        if (!approaches.isEmpty()) {
            return new PathAnalysis(distinctApproaches > 1, Math.max(1, distinctApproaches));
        }

        int indicators = MULTIPLE_PATHS.countOccurrences(content);
        int explicitOptions = countExplicitOptions(content);

        boolean multiplePaths = indicators >= 2 || explicitOptions >= 2;
        return new PathAnalysis(multiplePaths, multiplePaths ? Math.max(2, explicitOptions) : 1);
    }

    OutcomeAnalysis analyzeMultipleOutcomes(String content, List<String> objectives, Boolean explicit) {
        int distinctObjectives = distinctCount(objectives);

        if (explicit != null) {
            return new OutcomeAnalysis(explicit, explicit ? Math.max(2, distinctObjectives) : 1);
        }

        if (!objectives.isEmpty()) {
            return new OutcomeAnalysis(distinctObjectives > 1, Math.max(1, distinctObjectives));
        }

        int indicators = MULTIPLE_OUTCOMES.countOccurrences(content);
        int listed = countListedObjectives(content);

        boolean multipleOutcomes = indicators >= 2 || listed >= 2;
        return new OutcomeAnalysis(multipleOutcomes, multipleOutcomes ? Math.max(2, listed) : 1);
    }

    ConflictAnalysis analyzeConflicts(String content, List<String> tradeoffs, Boolean explicit) {
        if (explicit != null) {
            if (!explicit) {
                return new ConflictAnalysis(false, List.of());
            }
            return new ConflictAnalysis(true, tradeoffs.isEmpty() ? List.of(DEFAULT_CONFLICT) : limit(tradeoffs));
        }

        if (!tradeoffs.isEmpty()) {
            return new ConflictAnalysis(true, limit(tradeoffs));
        }

        Set<String> contexts = new LinkedHashSet<>();
        int indicators = 0;

        for (PatternRule rule : CONFLICTS.getRules()) {
            List<MatchResult> matches = rule.results(content).toList();
            indicators += matches.size();
            for (MatchResult match : matches.subList(0, Math.min(MATCHES_PER_CONFLICT_RULE, matches.size()))) {
                if (contexts.size() >= MAX_CONFLICTS) {
                    break;
                }
                contexts.add(contextAround(content, match));
            }
        }

        List<String> conflicts = new ArrayList<>(contexts);
        return new ConflictAnalysis(indicators >= 2 || !conflicts.isEmpty(), conflicts);
    }

    UncertaintyAnalysis analyzeUncertainty(String content, List<String> informationGaps, Boolean explicit) {
        if (Boolean.FALSE.equals(explicit)) {
            return new UncertaintyAnalysis(UncertaintyLevel.NONE, 0);
        }

        if (Boolean.TRUE.equals(explicit) && !informationGaps.isEmpty()) {
            UncertaintyLevel level = informationGaps.size() >= 3 ? UncertaintyLevel.HIGH : UncertaintyLevel.BOUNDED;
            return new UncertaintyAnalysis(level, informationGaps.size());
        }

        int high = UNCERTAINTY_HIGH.countOccurrences(content);
        int bounded = UNCERTAINTY_BOUNDED.countOccurrences(content);

        UncertaintyLevel level;
        if (high >= 2) {
            level = UncertaintyLevel.HIGH;
        } else if (high >= 1 || bounded >= 2 || Boolean.TRUE.equals(explicit)) {
            level = UncertaintyLevel.BOUNDED;
        } else {
            level = UncertaintyLevel.NONE;
        }
        return new UncertaintyAnalysis(level, high + bounded);
    }

    private int countExplicitOptions(String content) {
        Set<String> options = new LinkedHashSet<>();
        Matcher matcher = EXPLICIT_OPTION.matcher(content);
        while (matcher.find()) {
            options.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return Math.min(options.size(), MAX_EXPLICIT_OPTIONS);
    }

    /**
     * Counts list items after the first "objectives are / include / :" marker.
     * Bulleted or numbered items win; otherwise a comma-separated list counts commas plus one.
     */
    private int countListedObjectives(String content) {
        Matcher start = OBJECTIVE_LIST_START.matcher(content);
        if (!start.find()) {
            return 0;
        }
        String following = content.substring(start.end(), Math.min(content.length(), start.end() + LIST_LOOKAHEAD));

        Matcher items = LIST_ITEM.matcher(following);
        int bullets = 0;
        while (items.find()) {
            bullets++;
        }
        if (bullets > 0) {
            return bullets;
        }

        long commas = following.chars().filter(c -> c == ',').count();
        return commas >= 1 ? (int) commas + 1 : 0;
    }

    private static String contextAround(String content, MatchResult match) {
        int start = Math.max(0, match.start() - CONTEXT_BEFORE);
        int end = Math.min(content.length(), match.end() + CONTEXT_AFTER);
        return content.substring(start, end).trim().replaceAll("\\s+", " ");
    }

    private static int distinctCount(List<String> items) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String item : items) {
            if (item != null && !item.isBlank()) {
                distinct.add(RuleTable.normalize(item));
            }
        }
        return distinct.size();
    }

    private static List<String> limit(List<String> items) {
        return items.stream().limit(MAX_CONFLICTS).toList();
    }

    record PathAnalysis(boolean multiplePaths, int pathCount) {
    }

    record OutcomeAnalysis(boolean multipleOutcomes, int outcomeCount) {
    }

    record ConflictAnalysis(boolean conflicting, List<String> conflicts) {
    }

    record UncertaintyAnalysis(UncertaintyLevel level, int indicators) {
    }
}
