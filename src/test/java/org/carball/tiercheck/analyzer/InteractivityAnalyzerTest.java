package org.carball.tiercheck.analyzer;

import org.carball.tiercheck.model.metrics.ElementInteractivityAnalysis;
import org.carball.tiercheck.model.scenario.ScenarioVariable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class InteractivityAnalyzerTest {

    private final InteractivityAnalyzer analyzer = new InteractivityAnalyzer();

    @Test
    void shouldAnalyzeSimpleAdditionScenario() {
        // Given
        InteractivityInput input = InteractivityInput.builder()
                .content("Calculate the sum of 5 and 10.")
                .woodTotalElements(2)
                .steps(List.of(new InteractivityInput.StepNode("step-1", List.of(), List.of())))
                .build();

        // When
        ElementInteractivityAnalysis analysis = analyzer.analyze(input);

        // Then
        assertThat(analysis.totalElements()).isEqualTo(2);
        assertThat(analysis.simultaneousElements()).isEqualTo(2);
        assertThat(analysis.interactivityRatio()).isEqualTo(1.0);
        assertThat(analysis.dependencyDepth()).isZero();
        assertThat(analysis.dependencyEdges()).isZero();
        assertThat(analyzer.calculateScore(analysis)).isEqualTo(10.0);
    }

    @Test
    void shouldCountBackEdgeAsLeafByDefault() {
        // Given
        InteractivityInput input = cyclicInput();

        // When
        ElementInteractivityAnalysis analysis = analyzer.analyze(input);

        // Then
        assertThat(analysis.dependencyEdges()).isEqualTo(2);
        assertThat(analysis.dependencyDepth()).isEqualTo(2);
        assertThat(analysis.simultaneousElements()).isEqualTo(2); // max out-degree + 1
        assertThat(analysis.interactivityRatio()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldIgnoreBackEdgeWhenConfigured() {
        // Given
        InteractivityAnalyzer ignoring = new InteractivityAnalyzer(CycleBreakPolicy.IGNORE_BACK_EDGE);

        // When
        ElementInteractivityAnalysis analysis = ignoring.analyze(cyclicInput());

        // Then
        assertThat(analysis.dependencyEdges()).isEqualTo(2);
        assertThat(analysis.dependencyDepth()).isEqualTo(1);
    }

    @Test
    void shouldCountEdgesOfStepSharingVariableName() {
        // Given
        InteractivityInput input = InteractivityInput.builder()
                .content("")
                .totalElements(6)
                .variables(List.of(ScenarioVariable.of("total", null, "price", "quantity")))
                .steps(List.of(new InteractivityInput.StepNode("total", List.of("discount"), List.of())))
                .build();

        // When
        ElementInteractivityAnalysis analysis = analyzer.analyze(input);

        // Then
        assertThat(analyzer.countDeclaredEdges(input)).isEqualTo(3);
        assertThat(analysis.dependencyEdges()).isEqualTo(3);
    }

    @Test
    void shouldEstimateDependenciesFromText() {
        // Given
        String content = "Using the totals, compute tax based on income. The result of step one feeds into step two.";

        // When
        ElementInteractivityAnalysis analysis = analyzer.analyze(InteractivityInput.builder()
                .content(content)
                .totalElements(10)
                .build());

        // Then
        assertThat(analysis.dependencyEdges()).isEqualTo(4);
        assertThat(analysis.dependencyDepth()).isEqualTo(2); // ceil(4 / 3)
    }

    @Test
    void shouldRaiseSimultaneousElementsForIntegrationLanguage() {
        // Given
        String content = "Simultaneously weigh all of the factors, taking into account the overall budget.";

        // When
        ElementInteractivityAnalysis analysis = analyzer.analyze(InteractivityInput.builder()
                .content(content)
                .totalElements(9)
                .build());

        // Then
        assertThat(analysis.simultaneousElements()).isEqualTo(7); // ceil(9 * 0.7)
        assertThat(analysis.interactivityRatio()).isCloseTo(7 / 9.0, within(1e-9));
    }

    @Test
    void shouldResolveTotalElementsInPriorityOrder() {
        InteractivityInput explicitZero = InteractivityInput.builder()
                .content("").totalElements(0).woodTotalElements(9).build();
        InteractivityInput fromWood = InteractivityInput.builder()
                .content("").woodTotalElements(9).build();
        InteractivityInput fromSteps = InteractivityInput.builder()
                .content("")
                .steps(List.of(
                        new InteractivityInput.StepNode("s1", List.of("price"), List.of("revenue")),
                        new InteractivityInput.StepNode("s2", List.of("revenue"), List.of("tax"))))
                .build();

        assertThat(analyzer.determineTotalElements(explicitZero)).isZero();
        assertThat(analyzer.determineTotalElements(fromWood)).isEqualTo(9);
        assertThat(analyzer.determineTotalElements(fromSteps)).isEqualTo(5); // s1 s2 price revenue tax
    }

    @Test
    void shouldReportZeroRatioWithoutElements() {
        ElementInteractivityAnalysis analysis = analyzer.analyze(InteractivityInput.builder()
                .content("Nothing here.")
                .totalElements(0)
                .build());

        assertThat(analysis.interactivityRatio()).isZero();
    }

    @Test
    void shouldEstimateElementsFromNumbersAndTerms() {
        int elements = analyzer.estimateElementsFromContent("The total cost is 400 and the rate is 5.");

        assertThat(elements).isEqualTo(5); // 400, 5, total, cost, rate
    }

    @Test
    void shouldCapScoreContributions() {
        ElementInteractivityAnalysis analysis = ElementInteractivityAnalysis.builder()
                .totalElements(10)
                .simultaneousElements(10)
                .interactivityRatio(1.0)
                .dependencyDepth(9)
                .dependencyEdges(40)
                .build();

        assertThat(analyzer.calculateScore(analysis)).isEqualTo(15.0); // 10 + 3 + 2
    }

    private static InteractivityInput cyclicInput() {
        return InteractivityInput.builder()
                .content("")
                .totalElements(4)
                .variables(List.of(ScenarioVariable.of("A", null, "B"), ScenarioVariable.of("B", null, "A")))
                .build();
    }
}
