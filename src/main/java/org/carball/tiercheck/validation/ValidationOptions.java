package org.carball.tiercheck.validation;

import lombok.Builder;
import lombok.Value;
import org.carball.tiercheck.config.ComplexityValidationConfig;

@Value
@Builder(toBuilder = true)
public class ValidationOptions {

    @Builder.Default
    ComplexityValidationConfig config = ComplexityValidationConfig.defaults();

    @Builder.Default
    ValidationProgressListener listener = ValidationProgressListener.NONE;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }

    public static ValidationOptions withConfig(ComplexityValidationConfig config) {
        return ValidationOptions.builder().config(config).build();
    }
}
