package org.carball.tiercheck.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much the task's inputs change while it is being performed.
 */
public enum DynamicComplexity {
    STATIC("static"),
    LOW("low"),
    HIGH("high");

    private final String label;

    DynamicComplexity(String label) {
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
