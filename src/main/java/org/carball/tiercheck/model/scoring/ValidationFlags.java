package org.carball.tiercheck.model.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary flags plus the named per-criterion checks against the intended tier.
 * {@code criteriaChecks} keeps the criteria in evaluation order.
 */
public record ValidationFlags(
        boolean meetsMinimumCriteria,
        boolean hasRequiredAttributes,
        boolean withinTierBounds,
        boolean interactivityMatches,
        Map<String, Boolean> criteriaChecks) {

    public ValidationFlags {
        criteriaChecks = criteriaChecks == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(criteriaChecks));
    }

    public static ValidationFlags allFailed() {
        return new ValidationFlags(false, false, false, false, Map.of());
    }

    public long passedCount() {
        return criteriaChecks.values().stream().filter(Boolean::booleanValue).count();
    }

    public boolean passed(String criterion) {
        return Boolean.TRUE.equals(criteriaChecks.get(criterion));
    }
}
