package org.carball.tiercheck.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ValidationProfileTest {

    @Test
    void shouldBuildStrictProfile() {
        // Given
        ValidationProfile profile = ValidationProfile.STRICT;

        // When
        ComplexityValidationConfig config = profile.buildConfig();

        // Then
        assertThat(config.isStrictMode()).isTrue();
        assertThat(config.getAllowedTierDeviation()).isZero();
        assertThat(config.getMinimumConfidence()).isEqualTo(0.7);
        assertThat(config.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldBuildResearchProfileWithLongerTimeout() {
        // When
        ComplexityValidationConfig config = ValidationProfile.RESEARCH.buildConfig();

        // Then
        assertThat(config.getMaxRegenerationAttempts()).isEqualTo(5);
        assertThat(config.getValidationTimeoutMs()).isEqualTo(10_000);
        assertThat(config.getMinimumConfidence()).isEqualTo(0.75);
    }

    @Test
    void shouldMatchDefaultsForDefaultProfile() {
        ComplexityValidationConfig fromProfile = ValidationProfile.DEFAULT.buildConfig();
        ComplexityValidationConfig defaults = ComplexityValidationConfig.defaults();

        assertThat(fromProfile.isStrictMode()).isEqualTo(defaults.isStrictMode());
        assertThat(fromProfile.getAllowedTierDeviation()).isEqualTo(defaults.getAllowedTierDeviation());
        assertThat(fromProfile.getMinimumConfidence()).isEqualTo(defaults.getMinimumConfidence());
        assertThat(fromProfile.getProfileDescription()).isEqualTo(defaults.getProfileDescription());
    }

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(ValidationProfile.fromName("Exploratory")).isEqualTo(ValidationProfile.EXPLORATORY);
        assertThat(ValidationProfile.fromName("RESEARCH")).isEqualTo(ValidationProfile.RESEARCH);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> ValidationProfile.fromName("lenient"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown validation profile: lenient")
                .hasMessageContaining("default, strict, exploratory, research");
    }

    @Test
    void shouldListProfilesInHelp() {
        String help = ValidationProfile.getProfileHelp();

        assertThat(help).contains("default", "strict", "exploratory", "research");
        assertThat(help).contains("--profile <name>");
    }
}
