package org.carball.tiercheck.config;

import lombok.Getter;

@Getter
public enum ValidationProfile {

    DEFAULT("default", "Lenient acceptance within one tier of the target",
            false, 1, 0.6, 3),

    STRICT("strict", "Exact tier match with higher confidence",
            true, 0, 0.7, 3),

    EXPLORATORY("exploratory", "Accepts any tier at lower confidence, for calibration runs",
            false, 2, 0.5, 1),

    RESEARCH("research", "Exact tier match for study datasets, with more regeneration attempts",
            true, 0, 0.75, 5) {
        @Override
        public ComplexityValidationConfig buildConfig() {
            ComplexityValidationConfig base = super.buildConfig();
            return base.toBuilder()
                    .validationTimeoutMs(10_000) // Longer narratives
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final boolean strictMode;
    private final int allowedTierDeviation;
    private final double minimumConfidence;
    private final int maxRegenerationAttempts;

    ValidationProfile(String name, String description, boolean strictMode,
                      int allowedTierDeviation, double minimumConfidence, int maxRegenerationAttempts) {
        this.name = name;
        this.description = description;
        this.strictMode = strictMode;
        this.allowedTierDeviation = allowedTierDeviation;
        this.minimumConfidence = minimumConfidence;
        this.maxRegenerationAttempts = maxRegenerationAttempts;
    }

    public ComplexityValidationConfig buildConfig() {
        return ComplexityValidationConfig.builder()
                .profileName(name)
                .profileDescription(description)
                .strictMode(strictMode)
                .allowedTierDeviation(allowedTierDeviation)
                .minimumConfidence(minimumConfidence)
                .maxRegenerationAttempts(maxRegenerationAttempts)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static ValidationProfile fromName(String name) {
        for (ValidationProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown validation profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ValidationProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Validation Profiles:\n\n");
        for (ValidationProfile profile : values()) {
            help.append(String.format("  %-14s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile, or --help-config for individual settings.\n");
        return help.toString();
    }
}
