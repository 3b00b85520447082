package org.carball.tiercheck.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class ValidatorCliConfig {
    private Path scenarioFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
    private ComplexityValidationConfig validationConfig;
}
