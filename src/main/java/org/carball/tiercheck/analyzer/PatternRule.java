package org.carball.tiercheck.analyzer;

import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One case-insensitive pattern in a {@link RuleTable}.
 *
 * @param category optional grouping inside the table, e.g. a vocabulary family
 * @param weight   contribution of each occurrence when the table is folded into a score
 */
public record PatternRule(String name, String category, Pattern pattern, double weight) {

    public static PatternRule of(String name, String regex) {
        return new PatternRule(name, null, compile(regex), 1.0);
    }

    public static PatternRule inCategory(String category, String name, String regex) {
        return new PatternRule(name, category, compile(regex), 1.0);
    }

    static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public PatternRule withWeight(double newWeight) {
        return new PatternRule(name, category, pattern, newWeight);
    }

    public boolean matches(CharSequence content) {
        return pattern.matcher(content).find();
    }

    public int count(CharSequence content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public Stream<MatchResult> results(CharSequence content) {
        return pattern.matcher(content).results();
    }
}
