package org.carball.tiercheck.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How calculation steps depend on one another.
 */
public enum CoordinativeComplexity {
    SEQUENTIAL("sequential"),
    INTERDEPENDENT("interdependent"),
    NETWORKED("networked");

    private final String label;

    CoordinativeComplexity(String label) {
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
