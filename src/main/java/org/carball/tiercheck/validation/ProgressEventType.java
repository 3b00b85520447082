package org.carball.tiercheck.validation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressEventType {
    VALIDATION_START("validation_start"),
    VALIDATION_PROGRESS("validation_progress"),
    VALIDATION_COMPLETE("validation_complete"),
    BATCH_COMPLETE("batch_complete");

    private final String label;

    ProgressEventType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
