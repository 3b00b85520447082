package org.carball.tiercheck.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.tiercheck.config.ComplexityValidationConfig;
import org.carball.tiercheck.config.ConfigurationLoader;
import org.carball.tiercheck.config.OutputFormat;
import org.carball.tiercheck.config.ValidationProfile;
import org.carball.tiercheck.config.ValidatorCliConfig;
import org.carball.tiercheck.model.scenario.ScenarioInput;
import org.carball.tiercheck.model.scoring.Tier;
import org.carball.tiercheck.output.ValidationReport;
import org.carball.tiercheck.validation.BatchValidationResult;
import org.carball.tiercheck.validation.ProgressEventType;
import org.carball.tiercheck.validation.ScenarioValidationResult;
import org.carball.tiercheck.validation.ValidationBatchStats;
import org.carball.tiercheck.validation.ValidationEngine;
import org.carball.tiercheck.validation.ValidationOptions;
import org.carball.tiercheck.validation.ValidationProgressListener;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Slf4j
public class ComplexityValidatorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Scenario Complexity Tier Validator v%s            ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    private static final String DEFAULT_OUTPUT = "validation-report.json";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the validator and returns the process exit status.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            ValidatorCliConfig cliConfig = parseArgs(args);
            ComplexityValidationConfig config = cliConfig.getValidationConfig();

            System.out.println("\n🔍 Starting validation...");
            System.out.println("   Scenario file: " + cliConfig.getScenarioFile());
            System.out.println("   " + config.getConfigurationSummary());
            if (cliConfig.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(cliConfig.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + cliConfig.getOutputFile());
            }
            System.out.println();

            System.out.print("📂 Reading scenarios... ");
            List<ScenarioInput> scenarios = readScenarios(cliConfig.getScenarioFile());
            System.out.println("✓ (" + scenarios.size() + ")");

            System.out.println("📊 Validating scenarios...");
            ValidationOptions options = ValidationOptions.builder()
                    .config(config)
                    .listener(progressPrinter(cliConfig.isVerbose()))
                    .build();
            BatchValidationResult batch = new ValidationEngine().validateBatch(scenarios, options);

            System.out.print("📝 Writing results... ");
            outputResults(batch, cliConfig);
            System.out.println("✓");

            printSummary(batch);

            System.out.println("\n✅ Validation complete!");
            if (cliConfig.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(cliConfig.getOutputFile());
                System.out.println("   Output files:");
                System.out.println("     - " + baseFileName + ".json");
                System.out.println("     - " + baseFileName + ".md");
            } else {
                System.out.println("   Output file: " + cliConfig.getOutputFile());
            }
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        List<String> arguments = Arrays.asList(args);
        return arguments.contains("--help") || arguments.contains("-h");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar tiercheck.jar <scenarios-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  scenarios-file      JSON or YAML list of scenarios (id, intendedTier, content, hints)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: " + DEFAULT_OUTPUT + ")");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --config            YAML file with validation settings");
        System.out.println("  --profile           Validation profile: " + ValidationProfile.getAvailableProfiles());
        System.out.println("  --strict            Require an exact tier match");
        System.out.println("  --verbose, -v       Print every scenario as it completes");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ValidationProfile.getProfileHelp());
        System.out.println(ConfigurationLoader.getConfigHelp());
        System.out.println("Examples:");
        System.out.println("  # Validate with defaults");
        System.out.println("  java -jar tiercheck.jar scenarios.json");
        System.out.println();
        System.out.println("  # Strict profile, JSON and Markdown reports");
        System.out.println("  java -jar tiercheck.jar scenarios.yml --profile strict -f both -o reports/run1");
    }

    static ValidatorCliConfig parseArgs(String[] args) throws IOException {
        ValidatorCliConfig cliConfig = new ValidatorCliConfig();
        cliConfig.setScenarioFile(Paths.get(args[0]));
        cliConfig.setOutputFile(DEFAULT_OUTPUT);
        cliConfig.setOutputFormat(OutputFormat.JSON);
        cliConfig.setVerbose(false);

        String configFile = null;
        String profileName = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    cliConfig.setOutputFile(requireValue(args, i++, "Output file not specified"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        cliConfig.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--config":
                    configFile = requireValue(args, i++, "Configuration file not specified");
                    break;

                case "--profile":
                    profileName = requireValue(args, i++, "Profile name not specified");
                    break;

                case "--verbose":
                case "-v":
                    cliConfig.setVerbose(true);
                    break;

                case "--strict":
                    // Boolean flag, applied by ConfigurationLoader
                    break;

                default:
                    if (args[i].startsWith("--config.")) {
                        // Value applied by ConfigurationLoader
                        String option = args[i];
                        requireValue(args, i++, "Value not specified for " + option);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        String baseFileName = removeFileExtension(cliConfig.getOutputFile());
        cliConfig.setOutputFile(baseFileName + (cliConfig.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        ConfigurationLoader loader = new ConfigurationLoader();
        ComplexityValidationConfig base;
        if (configFile != null) {
            base = loader.loadFromYaml(Paths.get(configFile));
        } else if (profileName != null) {
            base = loader.loadProfile(profileName);
        } else {
            base = ComplexityValidationConfig.defaults();
        }
        cliConfig.setValidationConfig(loader.overlay(base, args));

        validateConfig(cliConfig);
        return cliConfig;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    private static void validateConfig(ValidatorCliConfig cliConfig) {
        if (!Files.exists(cliConfig.getScenarioFile())) {
            throw new IllegalArgumentException("Scenario file not found: " + cliConfig.getScenarioFile());
        }

        Path outputDir = Paths.get(cliConfig.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    static List<ScenarioInput> readScenarios(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yml") || name.endsWith(".yaml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        List<ScenarioInput> scenarios = mapper.readValue(file.toFile(), new TypeReference<List<ScenarioInput>>() { });
        for (int i = 0; i < scenarios.size(); i++) {
            ScenarioInput scenario = scenarios.get(i);
            if (scenario == null) {
                throw new IllegalArgumentException("Scenario file has an empty entry at position " + (i + 1));
            }
            if (scenario.intendedTier() == null) {
                throw new IllegalArgumentException("Scenario " + scenario.id() + " has no intendedTier");
            }
        }
        return scenarios;
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static ValidationProgressListener progressPrinter(boolean verbose) {
        return event -> {
            if (event.getType() != ProgressEventType.VALIDATION_PROGRESS) {
                return;
            }
            if (verbose) {
                System.out.printf("   [%d/%d] %s%n", event.getCurrent(), event.getTotal(), event.getMessage());
            } else {
                System.out.printf("\r   %d/%d (%d%%)", event.getCurrent(), event.getTotal(), event.getPercentage());
                if (event.getCurrent() == event.getTotal()) {
                    System.out.println();
                }
            }
        };
    }

    private static void outputResults(BatchValidationResult batch, ValidatorCliConfig cliConfig) throws IOException {
        ValidationReport report = new ValidationReport(batch, cliConfig.getValidationConfig());
        String baseFileName = removeFileExtension(cliConfig.getOutputFile());
        OutputFormat format = cliConfig.getOutputFormat();

        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            String jsonFile = format == OutputFormat.BOTH ? baseFileName + ".json" : cliConfig.getOutputFile();
            Files.writeString(Paths.get(jsonFile), report.toJson());
        }

        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            String markdownFile = format == OutputFormat.BOTH ? baseFileName + ".md" : cliConfig.getOutputFile();
            Files.writeString(Paths.get(markdownFile), report.toMarkdown());
        }
    }

    private static void printSummary(BatchValidationResult batch) {
        ValidationBatchStats stats = batch.getStats();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 VALIDATION SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nScenarios validated: " + stats.getTotalValidated());
        System.out.printf(Locale.ROOT, "Passed: %d (%.1f%%)%n", stats.getPassed(), stats.getPassRate() * 100);
        System.out.println("Failed: " + stats.getFailed());
        System.out.printf(Locale.ROOT, "Average confidence: %.2f%n", stats.getAvgConfidenceScore());

        System.out.println("\nPredicted tiers:");
        for (Tier tier : Tier.values()) {
            System.out.println("  " + tier.getBadge() + " " + tier + ": "
                    + stats.getPredictedTierDistribution().getOrDefault(tier.getLabel(), 0));
        }

        List<ScenarioValidationResult> rejected = batch.getResults().stream()
                .filter(r -> !r.isValid())
                .toList();
        if (!rejected.isEmpty()) {
            System.out.println("\n🔁 Scenarios to regenerate:");
            System.out.println("-".repeat(60));
            rejected.stream()
                    .limit(5)
                    .forEach(r -> {
                        System.out.printf("%-20s %s%n", r.getScenarioId(), r.outcome());
                        if (r.getRegenerationReason() != null) {
                            System.out.printf("  └─ %s%n", r.getRegenerationReason());
                        }
                    });
        }

        if (stats.getTotalValidated() == 0) {
            System.out.println("\n💡 The scenario file contained no scenarios.");
        }
    }
}
