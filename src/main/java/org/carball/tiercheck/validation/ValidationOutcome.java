package org.carball.tiercheck.validation;

/**
 * Where a scenario stands after one validation pass.
 */
public enum ValidationOutcome {
    /** Accepted for its intended tier. */
    VALID,
    /** Rejected; the caller may regenerate it with the returned guidance. */
    INVALID_RETRY,
    /** Rejected with no regeneration attempts left. */
    INVALID_EXHAUSTED
}
