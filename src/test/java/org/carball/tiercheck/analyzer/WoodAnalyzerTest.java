package org.carball.tiercheck.analyzer;

import org.carball.tiercheck.model.metrics.CoordinativeComplexity;
import org.carball.tiercheck.model.metrics.DynamicComplexity;
import org.carball.tiercheck.model.metrics.WoodMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class WoodAnalyzerTest {

    private WoodAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new WoodAnalyzer();
    }

    @Test
    void shouldAnalyzeSimpleAdditionScenario() {
        // Given
        WoodAnalysisInput input = WoodAnalysisInput.builder()
                .content("Calculate the sum of 5 and 10.")
                .calculationSteps(List.of("Add 5 and 10"))
                .hasStateChanges(false)
                .build();

        // When
        WoodMetrics metrics = analyzer.analyze(input);

        // Then
        assertThat(metrics.distinctActs()).isEqualTo(2); // one step, raised to the minimum
        assertThat(metrics.informationCuesPerAct()).isEqualTo(1.0);
        assertThat(metrics.totalElements()).isEqualTo(2);
        assertThat(metrics.coordinativeComplexity()).isEqualTo(CoordinativeComplexity.SEQUENTIAL);
        assertThat(metrics.dynamicComplexity()).isEqualTo(DynamicComplexity.STATIC);
        assertThat(analyzer.calculateScore(metrics)).isEqualTo(3.0);
    }

    @Test
    void shouldClampExplicitStepsToMaximum() {
        // Given
        WoodAnalysisInput input = WoodAnalysisInput.builder()
                .content("Many steps.")
                .calculationSteps(Collections.nCopies(20, "step"))
                .build();

        // When
        int acts = analyzer.countDistinctActs(input.content(), input);

        // Then
        assertThat(acts).isEqualTo(WoodAnalyzer.MAX_DISTINCT_ACTS);
    }

    @Test
    void shouldCountCalculationVerbsWhenNoStepsGiven() {
        // Given
        String content = "Calculate the revenue, then determine the margin and compare the results.";

        // When
        int acts = analyzer.countDistinctActs(content, WoodAnalysisInput.ofContent(content));

        // Then
        assertThat(acts).isEqualTo(3);
    }

    @Test
    void shouldPreferNumberedItemsOverVerbs() {
        // Given
        String content = "Work through the following:\n1. Sum sales\n2. Subtract returns\n3. Apply tax\n4. Report";

        // When
        int acts = analyzer.countDistinctActs(content, WoodAnalysisInput.ofContent(content));

        // Then
        assertThat(acts).isEqualTo(4);
    }

    @Test
    void shouldUseVariableCountAsInformationCues() {
        // Given
        WoodAnalysisInput input = WoodAnalysisInput.builder()
                .content("Revenue of $1,000 and a 20% margin.")
                .variables(List.of("a", "b", "c"))
                .build();

        // When
        int cues = analyzer.countInformationCues(input.content(), input);

        // Then
        assertThat(cues).isEqualTo(3);
    }

    @Test
    void shouldTreatDependencyCycleAsNetworked() {
        // Given
        WoodAnalysisInput input = WoodAnalysisInput.builder()
                .content("Plain text.")
                .dependencies(List.of(
                        new WoodAnalysisInput.Dependency("price", "demand"),
                        new WoodAnalysisInput.Dependency("demand", "price")))
                .build();

        // When
        CoordinativeComplexity coordinative = analyzer.determineCoordinativeComplexity(input.content(), input);

        // Then
        assertThat(coordinative).isEqualTo(CoordinativeComplexity.NETWORKED);
    }

    @Test
    void shouldTreatSharedDependencyTargetAsInterdependent() {
        // Given
        WoodAnalysisInput input = WoodAnalysisInput.builder()
                .content("Plain text.")
                .dependencies(List.of(
                        new WoodAnalysisInput.Dependency("profit", "cost"),
                        new WoodAnalysisInput.Dependency("margin", "cost")))
                .build();

        // When
        CoordinativeComplexity coordinative = analyzer.determineCoordinativeComplexity(input.content(), input);

        // Then
        assertThat(coordinative).isEqualTo(CoordinativeComplexity.INTERDEPENDENT);
    }

    @Test
    void shouldFallBackToTextWhenDependencyChainIsLinear() {
        // Given
        WoodAnalysisInput input = WoodAnalysisInput.builder()
                .content("Add the numbers.")
                .dependencies(List.of(
                        new WoodAnalysisInput.Dependency("a", "b"),
                        new WoodAnalysisInput.Dependency("b", "c")))
                .build();

        // When
        CoordinativeComplexity coordinative = analyzer.determineCoordinativeComplexity(input.content(), input);

        // Then
        assertThat(coordinative).isEqualTo(CoordinativeComplexity.SEQUENTIAL);
    }

    @Test
    void shouldDetectNetworkedLanguage() {
        // Given
        String content = "The pricing model runs iteratively and each change has a ripple effect on demand.";

        // When
        CoordinativeComplexity coordinative =
                analyzer.determineCoordinativeComplexity(content, WoodAnalysisInput.ofContent(content));

        // Then
        assertThat(coordinative).isEqualTo(CoordinativeComplexity.NETWORKED);
    }

    @Test
    void shouldHonorExplicitStateChangeFlag() {
        String volatileText = "Prices are highly volatile and unpredictable.";

        assertThat(analyzer.determineDynamicComplexity(volatileText, false)).isEqualTo(DynamicComplexity.STATIC);
        assertThat(analyzer.determineDynamicComplexity("Nothing moves.", true)).isEqualTo(DynamicComplexity.HIGH);
    }

    @Test
    void shouldInferDynamicComplexityFromText() {
        assertThat(analyzer.determineDynamicComplexity("Prices are highly volatile and unpredictable.", null))
                .isEqualTo(DynamicComplexity.HIGH);
        assertThat(analyzer.determineDynamicComplexity("The rate may change next year.", null))
                .isEqualTo(DynamicComplexity.LOW);
        assertThat(analyzer.determineDynamicComplexity("Add two numbers.", null))
                .isEqualTo(DynamicComplexity.STATIC);
    }

    @Test
    void shouldCapScoreFactors() {
        // Given
        WoodMetrics metrics = WoodMetrics.builder()
                .distinctActs(15)
                .informationCuesPerAct(7.0)
                .totalElements(105)
                .coordinativeComplexity(CoordinativeComplexity.NETWORKED)
                .dynamicComplexity(DynamicComplexity.HIGH)
                .build();

        // When
        double score = analyzer.calculateScore(metrics);

        // Then
        assertThat(score).isEqualTo(19.0); // 5 + 5 + 5 + 4
    }

    @Test
    void shouldScoreModerateMetrics() {
        // Given
        WoodMetrics metrics = WoodMetrics.builder()
                .distinctActs(4)
                .informationCuesPerAct(2.0)
                .totalElements(8)
                .coordinativeComplexity(CoordinativeComplexity.INTERDEPENDENT)
                .dynamicComplexity(DynamicComplexity.LOW)
                .build();

        // When
        double score = analyzer.calculateScore(metrics);

        // Then
        assertThat(score).isEqualTo(9.0); // 2 + 2 + 3 + 2
    }

    @Test
    void shouldReportFailureForMissingContent() {
        // When
        AnalyzerResult<WoodMetrics> result = analyzer.tryAnalyze(WoodAnalysisInput.ofContent(null));

        // Then
        assertThat(result.isOk()).isFalse();
        assertThat(result).isInstanceOfSatisfying(AnalyzerResult.Err.class,
                err -> assertThat(err.analyzer()).isEqualTo("wood"));
    }
}
