package org.carball.tiercheck.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimePressure {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    private final String label;

    TimePressure(String label) {
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
