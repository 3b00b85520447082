package org.carball.tiercheck.model.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered complexity tiers. Ordinal distance is used for tier deviation checks.
 */
public enum Tier {
    SIMPLE("simple", "🟢"),
    MODERATE("moderate", "🟡"),
    COMPLEX("complex", "🔴");

    private final String label;
    private final String badge;

    Tier(String label, String badge) {
        this.label = label;
        this.badge = badge;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getBadge() {
        return badge;
    }

    public int distanceTo(Tier other) {
        return Math.abs(ordinal() - other.ordinal());
    }

    @JsonCreator
    public static Tier fromLabel(String label) {
        for (Tier tier : values()) {
            if (tier.label.equalsIgnoreCase(label) || tier.name().equalsIgnoreCase(label)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + label + ". Use: simple, moderate, or complex");
    }

    @Override
    public String toString() {
        return label;
    }
}
