package org.carball.tiercheck.validation;

import lombok.Value;

import java.util.List;

/**
 * Per-scenario results in input order, plus batch statistics.
 */
@Value
public class BatchValidationResult {
    List<ScenarioValidationResult> results;
    ValidationBatchStats stats;
}
