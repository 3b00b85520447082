package org.carball.tiercheck.analyzer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RuleTableTest {

    private static final RuleTable COSTS = RuleTable.ofPatterns("test.costs", "1",
            "cost",
            "price",
            "fee");

    @Test
    void shouldCountOccurrencesAndMatchingRules() {
        // Given
        String content = "The cost, the other cost and the price.";

        // Then
        assertThat(COSTS.countOccurrences(content)).isEqualTo(3);
        assertThat(COSTS.countMatchingRules(content)).isEqualTo(2);
        assertThat(COSTS.anyMatch(content)).isTrue();
        assertThat(COSTS.anyMatch("nothing relevant")).isFalse();
    }

    @Test
    void shouldGiveSameAnswerOnRepeatedCalls() {
        String content = "Cost and price";

        assertThat(COSTS.countOccurrences(content)).isEqualTo(2);
        assertThat(COSTS.countOccurrences(content)).isEqualTo(2);
        assertThat(COSTS.anyMatch(content)).isTrue();
        assertThat(COSTS.anyMatch(content)).isTrue();
    }

    @Test
    void shouldApplyWeights() {
        RuleTable weighted = RuleTable.weighted("test.weighted", "1", 0.25, "risk", "doubt");

        assertThat(weighted.weightedOccurrences("risk, risk and doubt")).isEqualTo(0.75);
    }

    @Test
    void shouldNormalizeDistinctMatches() {
        RuleTable table = RuleTable.ofPatterns("test.phrases", "1", "cash\\s+flow");

        assertThat(table.distinctMatches("Cash  flow and CASH FLOW and cash\nflow"))
                .containsExactly("cash flow");
    }

    @Test
    void shouldCountCategoriesOnce() {
        // Given
        RuleTable table = RuleTable.of("test.categories", "1",
                PatternRule.inCategory("money", "money.cost", "cost"),
                PatternRule.inCategory("money", "money.price", "price"),
                PatternRule.inCategory("time", "time.days", "days"));

        // Then
        assertThat(table.countMatchingCategories("cost and price")).isEqualTo(1);
        assertThat(table.countMatchingCategories("cost within 5 days")).isEqualTo(2);
    }

    @Test
    void shouldCaptureFirstGroupUpToLimit() {
        RuleTable table = RuleTable.ofPatterns("test.capture", "1", "item:\\s*([^,]+)");

        assertThat(table.captureFirstGroup("item: a, item: b, item: c", 2)).containsExactly("a", "b");
    }

    @Test
    void shouldDescribeItself() {
        assertThat(COSTS.toString()).isEqualTo("test.costs@1 (3 rules)");
        assertThat(COSTS.getRules()).extracting(PatternRule::name)
                .containsExactly("test.costs[0]", "test.costs[1]", "test.costs[2]");
    }
}
