package org.carball.tiercheck.cli;

import org.carball.tiercheck.config.OutputFormat;
import org.carball.tiercheck.config.ValidatorCliConfig;
import org.carball.tiercheck.model.scenario.ScenarioInput;
import org.carball.tiercheck.model.scoring.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ComplexityValidatorCLITest {

    private static final String SCENARIOS_JSON = """
        [
          {
            "id": "sum",
            "intendedTier": "simple",
            "content": "Calculate the sum of 5 and 10.",
            "calculationSteps": ["Add 5 and 10"]
          },
          {
            "id": "trivial",
            "intendedTier": "COMPLEX",
            "content": "Simple addition: 5 + 10 = ?",
            "author": "ignored"
          }
        ]
        """;

    @TempDir
    Path tempDir;

    private Path scenarioFile;

    @BeforeEach
    void setUp() throws IOException {
        scenarioFile = tempDir.resolve("scenarios.json");
        Files.writeString(scenarioFile, SCENARIOS_JSON);
    }

    @Test
    void shouldReadJsonScenarios() throws IOException {
        // When
        List<ScenarioInput> scenarios = ComplexityValidatorCLI.readScenarios(scenarioFile);

        // Then
        assertThat(scenarios).hasSize(2);
        assertThat(scenarios.get(0).intendedTier()).isEqualTo(Tier.SIMPLE);
        assertThat(scenarios.get(0).calculationSteps()).containsExactly("Add 5 and 10");
        assertThat(scenarios.get(1).intendedTier()).isEqualTo(Tier.COMPLEX);
        assertThat(scenarios.get(1).calculationSteps()).isEmpty();
    }

    @Test
    void shouldReadYamlScenarios() throws IOException {
        // Given
        Path yamlFile = tempDir.resolve("scenarios.yml");
        Files.writeString(yamlFile, String.join("\n",
                "- id: budget",
                "  intendedTier: moderate",
                "  content: Compare leasing versus buying the truck.",
                "  domain: logistics",
                ""));

        // When
        List<ScenarioInput> scenarios = ComplexityValidatorCLI.readScenarios(yamlFile);

        // Then
        assertThat(scenarios).singleElement()
                .satisfies(scenario -> {
                    assertThat(scenario.id()).isEqualTo("budget");
                    assertThat(scenario.intendedTier()).isEqualTo(Tier.MODERATE);
                    assertThat(scenario.domain()).isEqualTo("logistics");
                });
    }

    @Test
    void shouldRejectScenarioWithoutIntendedTier() throws IOException {
        // Given
        Path file = tempDir.resolve("untiered.json");
        Files.writeString(file, "[{\"id\": \"x\", \"content\": \"Add 2 and 2.\"}]");

        // When/Then
        assertThatThrownBy(() -> ComplexityValidatorCLI.readScenarios(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Scenario x has no intendedTier");
    }

    @Test
    void shouldDropNullListEntries() throws IOException {
        // Given
        Path file = tempDir.resolve("gaps.json");
        Files.writeString(file, """
            [
              {
                "id": "gaps",
                "intendedTier": "simple",
                "content": "Calculate the sum of 5 and 10.",
                "calculationSteps": ["Add 5 and 10", null],
                "variables": [null, {"name": "total", "dependsOn": ["a", null]}]
              }
            ]
            """);

        // When
        List<ScenarioInput> scenarios = ComplexityValidatorCLI.readScenarios(file);

        // Then
        ScenarioInput scenario = scenarios.get(0);
        assertThat(scenario.calculationSteps()).containsExactly("Add 5 and 10");
        assertThat(scenario.variables()).singleElement()
                .satisfies(variable -> assertThat(variable.dependsOn()).containsExactly("a"));
    }

    @Test
    void shouldRejectEmptyScenarioEntry() throws IOException {
        // Given
        Path file = tempDir.resolve("holes.json");
        Files.writeString(file, "[{\"id\": \"x\", \"intendedTier\": \"simple\", \"content\": \"Add 2 and 2.\"}, null]");

        // When/Then
        assertThatThrownBy(() -> ComplexityValidatorCLI.readScenarios(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty entry at position 2");
    }

    @Test
    void shouldParseOptionsAndNormalizeOutputName() throws IOException {
        // Given
        String output = tempDir.resolve("run1.txt").toString();
        String[] args = {scenarioFile.toString(), "-o", output, "-f", "markdown",
                "--profile", "strict", "--config.max-regenerations", "4", "-v"};

        // When
        ValidatorCliConfig cliConfig = ComplexityValidatorCLI.parseArgs(args);

        // Then
        assertThat(cliConfig.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(cliConfig.getOutputFile()).isEqualTo(tempDir.resolve("run1.md").toString());
        assertThat(cliConfig.isVerbose()).isTrue();
        assertThat(cliConfig.getValidationConfig().getProfileName()).isEqualTo("strict");
        assertThat(cliConfig.getValidationConfig().getMaxRegenerationAttempts()).isEqualTo(4);
    }

    @Test
    void shouldRejectUnknownOption() {
        String[] args = {scenarioFile.toString(), "--colour"};

        assertThatThrownBy(() -> ComplexityValidatorCLI.parseArgs(args))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --colour");
    }

    @Test
    void shouldRejectMissingOptionValue() {
        String[] args = {scenarioFile.toString(), "--output"};

        assertThatThrownBy(() -> ComplexityValidatorCLI.parseArgs(args))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output file not specified");
    }

    @Test
    void shouldWriteBothReports() throws IOException {
        // Given
        String base = tempDir.resolve("report").toString();

        // When
        int exitCode = ComplexityValidatorCLI.run(new String[]{scenarioFile.toString(), "-o", base, "-f", "both"});

        // Then
        assertThat(exitCode).isZero();
        Path json = tempDir.resolve("report.json");
        Path markdown = tempDir.resolve("report.md");
        assertThat(json).exists();
        assertThat(markdown).exists();
        assertThat(Files.readString(json)).contains("\"scenarioId\" : \"sum\"");
        assertThat(Files.readString(markdown)).contains("### 2. trivial ❌");
    }

    @Test
    void shouldFailForMissingScenarioFile() {
        int exitCode = ComplexityValidatorCLI.run(new String[]{tempDir.resolve("missing.json").toString()});

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void shouldFailForInvalidFormat() {
        int exitCode = ComplexityValidatorCLI.run(new String[]{scenarioFile.toString(), "-f", "html"});

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void shouldFailForUnknownProfile() {
        int exitCode = ComplexityValidatorCLI.run(new String[]{scenarioFile.toString(), "--profile", "nonexistent"});

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void shouldReturnUsageExitCodes() {
        assertThat(ComplexityValidatorCLI.run(new String[0])).isEqualTo(1);
        assertThat(ComplexityValidatorCLI.run(new String[]{"--help"})).isZero();
    }

    @Test
    void shouldTreatBareHelpWordAsScenarioFile() {
        // "help" names a scenario file that does not exist here
        int exitCode = ComplexityValidatorCLI.run(new String[]{"help"});

        assertThat(exitCode).isEqualTo(1);
    }
}
