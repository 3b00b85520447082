package org.carball.tiercheck.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UncertaintyLevel {
    NONE("none"),
    BOUNDED("bounded"),
    HIGH("high");

    private final String label;

    UncertaintyLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isPresent() {
        return this != NONE;
    }

    @Override
    public String toString() {
        return label;
    }
}
