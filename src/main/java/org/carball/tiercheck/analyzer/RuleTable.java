package org.carball.tiercheck.analyzer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * A named, versioned list of pattern rules. Analyzers fold over tables instead of
 * holding inline regex lists, so the vocabulary can be reviewed and versioned on its own.
 * Matching is stateless: every call creates fresh matchers.
 */
public final class RuleTable {

    private final String name;
    private final String version;
    private final List<PatternRule> rules;

    private RuleTable(String name, String version, List<PatternRule> rules) {
        this.name = name;
        this.version = version;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static RuleTable of(String name, String version, PatternRule... rules) {
        return new RuleTable(name, version, Arrays.asList(rules));
    }

    /**
     * Builds a table whose rules are named {@code name[index]}.
     */
    public static RuleTable ofPatterns(String name, String version, String... regexes) {
        return weighted(name, version, 1.0, regexes);
    }

    public static RuleTable weighted(String name, String version, double weightPerMatch, String... regexes) {
        List<PatternRule> rules = new ArrayList<>();
        for (int i = 0; i < regexes.length; i++) {
            rules.add(PatternRule.of(name + "[" + i + "]", regexes[i]).withWeight(weightPerMatch));
        }
        return new RuleTable(name, version, rules);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public List<PatternRule> getRules() {
        return rules;
    }

    /**
     * Total number of non-overlapping occurrences across all rules.
     */
    public int countOccurrences(CharSequence content) {
        int total = 0;
        for (PatternRule rule : rules) {
            total += rule.count(content);
        }
        return total;
    }

    /**
     * Number of rules that match at least once.
     */
    public int countMatchingRules(CharSequence content) {
        int total = 0;
        for (PatternRule rule : rules) {
            if (rule.matches(content)) {
                total++;
            }
        }
        return total;
    }

    public double weightedOccurrences(CharSequence content) {
        double total = 0;
        for (PatternRule rule : rules) {
            total += rule.count(content) * rule.weight();
        }
        return total;
    }

    public boolean anyMatch(CharSequence content) {
        for (PatternRule rule : rules) {
            if (rule.matches(content)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of distinct rule categories with at least one matching rule.
     */
    public int countMatchingCategories(CharSequence content) {
        Set<String> categories = new LinkedHashSet<>();
        for (PatternRule rule : rules) {
            if (rule.category() != null && !categories.contains(rule.category()) && rule.matches(content)) {
                categories.add(rule.category());
            }
        }
        return categories.size();
    }

    /**
     * Distinct matched text across all rules, lower-cased with whitespace collapsed.
     */
    public Set<String> distinctMatches(CharSequence content) {
        Set<String> matches = new LinkedHashSet<>();
        for (PatternRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(content);
            while (matcher.find()) {
                matches.add(normalize(matcher.group()));
            }
        }
        return matches;
    }

    /**
     * Trimmed text of capture group 1 for each occurrence, in rule order, up to {@code limit} entries.
     */
    public List<String> captureFirstGroup(CharSequence content, int limit) {
        List<String> captured = new ArrayList<>();
        for (PatternRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(content);
            while (matcher.find() && captured.size() < limit) {
                String group = matcher.groupCount() >= 1 ? matcher.group(1) : null;
                if (group != null && !group.isBlank()) {
                    captured.add(group.trim());
                }
            }
            if (captured.size() >= limit) {
                break;
            }
        }
        return captured;
    }

    static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return name + "@" + version + " (" + rules.size() + " rules)";
    }
}
