package org.carball.tiercheck.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.tiercheck.analyzer.CompositeScorer;
import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.config.ValidationProfile;
import org.carball.tiercheck.model.scenario.ScenarioInput;
import org.carball.tiercheck.model.scoring.Tier;
import org.carball.tiercheck.validation.BatchValidationResult;
import org.carball.tiercheck.validation.ValidationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ValidationReportTest {

    private ValidationEngine engine;
    private ComplexityValidationConfig config;

    @BeforeEach
    void setUp() {
        engine = new ValidationEngine();
        config = ComplexityValidationConfig.defaults();
    }

    @Test
    void shouldRenderOneSectionPerScenario() {
        // Given
        ValidationReport report = new ValidationReport(sampleBatch(), config);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown).startsWith("# Scenario Complexity Validation Report");
        assertThat(markdown).contains("**Analyzer Version:** " + CompositeScorer.ANALYZER_VERSION);
        assertThat(markdown).contains("| Scenarios Validated | 2 |");
        assertThat(markdown).contains("| Pass Rate | 50.0% |");
        assertThat(markdown).contains("### 1. sum ✅");
        assertThat(markdown).contains("### 2. trivial ❌");
        assertThat(markdown).contains("Add more calculation steps (need at least 5 distinct steps)");
        assertThat(markdown).doesNotContain("No scenarios were validated");
    }

    @Test
    void shouldShowConfiguredScoreRanges() {
        String markdown = new ValidationReport(sampleBatch(), config).toMarkdown();

        assertThat(markdown).contains("| 30+ | 🔴 **Complex**");
        assertThat(markdown).contains("| 15-30 | 🟡 **Moderate**");
        assertThat(markdown).contains("| 0-15 | 🟢 **Simple**");
    }

    @Test
    void shouldHandleEmptyBatch() {
        // Given
        BatchValidationResult empty = engine.validateBatch(List.of());

        // When
        String markdown = new ValidationReport(empty, config).toMarkdown();

        // Then
        assertThat(markdown).contains("**No scenarios were validated.**");
        assertThat(markdown).contains("| Pass Rate | 0.0% |");
        assertThat(markdown).doesNotContain("### 1.");
    }

    @Test
    void shouldSerializeResultsAsJson() throws Exception {
        // Given
        ValidationReport report = new ValidationReport(sampleBatch(), ValidationProfile.STRICT.buildConfig());

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.path("reportMetadata").path("analyzerVersion").asText())
                .isEqualTo(CompositeScorer.ANALYZER_VERSION);
        assertThat(json.path("reportMetadata").path("profile").asText()).isEqualTo("strict");
        assertThat(json.path("stats").path("totalValidated").asInt()).isEqualTo(2);

        JsonNode first = json.path("scenarios").get(0);
        assertThat(first.path("scenarioId").asText()).isEqualTo("sum");
        assertThat(first.path("isValid").asBoolean()).isTrue();
        assertThat(first.path("intendedTier").asText()).isEqualTo("simple");
        assertThat(first.path("predictedTier").asText()).isEqualTo("simple");
        assertThat(first.path("breakdown").isObject()).isTrue();
        assertThat(first.has("regenerationReason")).isFalse();

        JsonNode second = json.path("scenarios").get(1);
        assertThat(second.path("isValid").asBoolean()).isFalse();
        assertThat(second.path("shouldRegenerate").asBoolean()).isTrue();
        assertThat(second.path("promptEnhancements").size()).isPositive();
    }

    private BatchValidationResult sampleBatch() {
        return engine.validateBatch(List.of(
                ScenarioInput.builder()
                        .id("sum")
                        .intendedTier(Tier.SIMPLE)
                        .content("Calculate the sum of 5 and 10.")
                        .calculationSteps(List.of("Add 5 and 10"))
                        .build(),
                ScenarioInput.of("trivial", Tier.COMPLEX, "Simple addition: 5 + 10 = ?", null)));
    }
}
