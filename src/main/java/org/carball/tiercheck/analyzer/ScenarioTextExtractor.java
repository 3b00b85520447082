package org.carball.tiercheck.analyzer;

import java.util.List;

/**
 * Pulls structural hints out of raw scenario text for the framework analyzers.
 */
public final class ScenarioTextExtractor {

    static final String RULES_VERSION = "1";

    /** Upper bound on items returned by each list extractor. */
    public static final int MAX_EXTRACTED_ITEMS = 5;

    private static final int STATE_CHANGE_FAMILIES_REQUIRED = 2;

    static final RuleTable CONDITIONALS = RuleTable.ofPatterns("extract.conditionals", RULES_VERSION,
            "if\\s+.*then",
            "when\\s+.*(?:occurs?|happens?)",
            "in\\s+(?:the\\s+)?case\\s+(?:of|that)",
            "depending\\s+on",
            "alternatively",
            "either\\s+.*\\s+or");

    static final RuleTable STATE_CHANGES = RuleTable.ofPatterns("extract.stateChanges", RULES_VERSION,
            "chang(?:e|es|ed|ing)",
            "updat(?:e|es|ed|ing)",
            "modif(?:y|ies|ied|ying)",
            "adjust(?:s|ed|ing)?",
            "over\\s+time",
            "period\\s+to\\s+period");

    static final RuleTable APPROACHES = RuleTable.ofPatterns("extract.approaches", RULES_VERSION,
            "(?:approach|method|option|alternative)\\s*(?:\\d+|[a-z])?\\s*[:\\-]?\\s*([^.]+)",
            "(?:can|could)\\s+(?:use|apply|employ)\\s+([^.]+)");

    static final RuleTable OBJECTIVES = RuleTable.ofPatterns("extract.objectives", RULES_VERSION,
            "(?:objective|goal|target|aim)\\s*(?:\\d+|[a-z])?\\s*[:\\-]?\\s*([^.]+)",
            "(?:maximize|minimize|optimize)\\s+([^.]+)");

    static final RuleTable TRADEOFFS = RuleTable.ofPatterns("extract.tradeoffs", RULES_VERSION,
            "trade-?off\\s*(?:between|of)?\\s*([^.]+)",
            "(?:balance|weigh)\\s+([^.]+)\\s+(?:against|vs\\.?)");

    static final RuleTable INFORMATION_GAPS = RuleTable.ofPatterns("extract.informationGaps", RULES_VERSION,
            "(?:unknown|unclear|unspecified|missing)\\s+([^.]+)",
            "(?:no|without)\\s+(?:information|data)\\s+(?:on|about)\\s+([^.]+)");

    private ScenarioTextExtractor() {
    }

    public static boolean hasConditionals(String content) {
        return CONDITIONALS.anyMatch(content);
    }

    /**
     * True when at least two distinct state-change families appear in the text.
     */
    public static boolean hasStateChanges(String content) {
        return STATE_CHANGES.countMatchingRules(content) >= STATE_CHANGE_FAMILIES_REQUIRED;
    }

    public static List<String> extractApproaches(String content) {
        return APPROACHES.captureFirstGroup(content, MAX_EXTRACTED_ITEMS);
    }

    public static List<String> extractObjectives(String content) {
        return OBJECTIVES.captureFirstGroup(content, MAX_EXTRACTED_ITEMS);
    }

    public static List<String> extractTradeoffs(String content) {
        return TRADEOFFS.captureFirstGroup(content, MAX_EXTRACTED_ITEMS);
    }

    public static List<String> extractInformationGaps(String content) {
        return INFORMATION_GAPS.captureFirstGroup(content, MAX_EXTRACTED_ITEMS);
    }
}
