package org.carball.tiercheck.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "TIERCHECK_";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public ComplexityValidationConfig loadConfiguration(String[] args) {
        log.debug("Loading configuration");
        return overlay(ComplexityValidationConfig.defaults(), args);
    }

    public ComplexityValidationConfig loadProfile(String profileName) {
        try {
            ValidationProfile profile = ValidationProfile.fromName(profileName);
            ComplexityValidationConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads the profile, then overlays environment variables and CLI arguments.
     */
    public ComplexityValidationConfig loadConfigurationWithProfile(String profileName, String[] args) {
        return overlay(loadProfile(profileName), args);
    }

    /**
     * Reads a YAML configuration file. Keys use snake_case; absent keys keep their defaults.
     */
    public ComplexityValidationConfig loadFromYaml(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }
        ComplexityValidationConfig config = yamlMapper.readValue(configFile.toFile(), ComplexityValidationConfig.class);
        log.info("Loaded validation configuration from: {}", configFile);
        return config;
    }

    /**
     * Applies environment variables and then CLI arguments on top of {@code base}.
     */
    public ComplexityValidationConfig overlay(ComplexityValidationConfig base, String[] args) {
        ComplexityValidationConfig.ComplexityValidationConfigBuilder builder = base.toBuilder();
        TierThresholds.TierThresholdsBuilder tiers = base.getTierThresholds().toBuilder();

        applyEnvironmentVariables(builder, tiers);
        applyCLIArguments(builder, tiers, args);

        ComplexityValidationConfig config = builder.tierThresholds(tiers.build()).build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyEnvironmentVariables(ComplexityValidationConfig.ComplexityValidationConfigBuilder builder,
                                           TierThresholds.TierThresholdsBuilder tiers) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (!entry.getKey().startsWith(ENV_PREFIX)) {
                continue;
            }
            String key = entry.getKey().substring(ENV_PREFIX.length());
            String value = entry.getValue();
            try {
                switch (key) {
                    case "STRICT_MODE":
                        builder.strictMode(Boolean.parseBoolean(value));
                        break;
                    case "ALLOWED_TIER_DEVIATION":
                        builder.allowedTierDeviation(Integer.parseInt(value));
                        break;
                    case "MAX_REGENERATION_ATTEMPTS":
                        builder.maxRegenerationAttempts(Integer.parseInt(value));
                        break;
                    case "MINIMUM_CONFIDENCE":
                        builder.minimumConfidence(Double.parseDouble(value));
                        break;
                    case "VALIDATION_TIMEOUT_MS":
                        builder.validationTimeoutMs(Long.parseLong(value));
                        break;
                    case "BATCH_PARALLELISM":
                        builder.batchParallelism(Integer.parseInt(value));
                        break;
                    case "MODERATE_MIN_SCORE":
                        tiers.moderateMin(Double.parseDouble(value));
                        break;
                    case "COMPLEX_MIN_SCORE":
                        tiers.complexMin(Double.parseDouble(value));
                        break;
                    default:
                        log.debug("Ignoring unrecognized environment variable {}", entry.getKey());
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", entry.getKey(), value);
            }
        }
    }

    private void applyCLIArguments(ComplexityValidationConfig.ComplexityValidationConfigBuilder builder,
                                   TierThresholds.TierThresholdsBuilder tiers, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if ("--strict".equals(arg)) {
                builder.strictMode(true);
                continue;
            }
            if (i + 1 >= args.length) {
                continue;
            }
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--config.strict-mode":
                        builder.strictMode(Boolean.parseBoolean(value));
                        break;
                    case "--config.allowed-deviation":
                        builder.allowedTierDeviation(Integer.parseInt(value));
                        break;
                    case "--config.max-regenerations":
                        builder.maxRegenerationAttempts(Integer.parseInt(value));
                        break;
                    case "--config.min-confidence":
                        builder.minimumConfidence(Double.parseDouble(value));
                        break;
                    case "--config.timeout-ms":
                        builder.validationTimeoutMs(Long.parseLong(value));
                        break;
                    case "--config.parallelism":
                        builder.batchParallelism(Integer.parseInt(value));
                        break;
                    case "--config.moderate-min":
                        tiers.moderateMin(Double.parseDouble(value));
                        break;
                    case "--config.complex-min":
                        tiers.complexMin(Double.parseDouble(value));
                        break;
                    case "--config.weights":
                        builder.weights(parseWeights(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private FrameworkWeights parseWeights(String value) {
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException(
                    "Weights must be four comma-separated numbers (wood,campbell,liuLi,interactivity): " + value);
        }
        return FrameworkWeights.builder()
                .wood(Double.parseDouble(parts[0].trim()))
                .campbell(Double.parseDouble(parts[1].trim()))
                .liuLi(Double.parseDouble(parts[2].trim()))
                .interactivity(Double.parseDouble(parts[3].trim()))
                .build();
    }

    public static String getConfigHelp() {
        return """
            Validation Configuration Options:

            CLI Arguments:
              --config.strict-mode <bool>        Require an exact tier match
              --strict                           Same as --config.strict-mode true
              --config.allowed-deviation <num>   Tiers a scenario may deviate when not strict (0-2)
              --config.max-regenerations <num>   Regeneration attempts before giving up
              --config.min-confidence <num>      Minimum confidence to accept a scenario (0-1)
              --config.timeout-ms <num>          Advisory per-scenario validation time budget
              --config.parallelism <num>         Scenarios validated concurrently in a batch
              --config.moderate-min <num>        Composite score where the moderate tier starts
              --config.complex-min <num>         Composite score where the complex tier starts
              --config.weights <w,c,l,i>         Wood, Campbell, Liu & Li, interactivity weights

            Environment Variables:
              TIERCHECK_STRICT_MODE               Same as --config.strict-mode
              TIERCHECK_ALLOWED_TIER_DEVIATION    Same as --config.allowed-deviation
              TIERCHECK_MAX_REGENERATION_ATTEMPTS Same as --config.max-regenerations
              TIERCHECK_MINIMUM_CONFIDENCE        Same as --config.min-confidence
              TIERCHECK_VALIDATION_TIMEOUT_MS     Same as --config.timeout-ms
              TIERCHECK_BATCH_PARALLELISM         Same as --config.parallelism
              TIERCHECK_MODERATE_MIN_SCORE        Same as --config.moderate-min
              TIERCHECK_COMPLEX_MIN_SCORE         Same as --config.complex-min

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file (--config) or profile (--profile)
              4. Built-in defaults
            """;
    }
}
