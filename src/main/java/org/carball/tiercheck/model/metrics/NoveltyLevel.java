package org.carball.tiercheck.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NoveltyLevel {
    ROUTINE("routine"),
    SEMI_FAMILIAR("semi-familiar"),
    NOVEL("novel");

    private final String label;

    NoveltyLevel(String label) {
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
