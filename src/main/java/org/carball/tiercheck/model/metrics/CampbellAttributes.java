package org.carball.tiercheck.model.metrics;

import lombok.Builder;

import java.util.List;

/**
 * The four Campbell (1988) complexity attributes and the resulting 16-type index.
 */
@Builder
public record CampbellAttributes(
        boolean multiplePaths,
        int pathCount,
        boolean multipleOutcomes,
        int outcomeCount,
        boolean conflictingInterdependence,
        List<String> conflicts,
        UncertaintyLevel uncertaintyLevel,
        int uncertaintyIndicators,
        int campbellType) {

    public static final int PATHS_BIT = 8;
    public static final int OUTCOMES_BIT = 4;
    public static final int CONFLICT_BIT = 2;
    public static final int UNCERTAINTY_BIT = 1;

    private static final String[] TYPE_DESCRIPTIONS = {
            "Simple Task (no complexity attributes)",
            "Uncertain Task",
            "Conflicting Task",
            "Conflicting Uncertain Task",
            "Multi-Outcome Task",
            "Uncertain Multi-Outcome Task",
            "Conflicting Multi-Outcome Task",
            "Conflicting Uncertain Multi-Outcome Task",
            "Multi-Path Task",
            "Uncertain Multi-Path Task",
            "Conflicting Multi-Path Task",
            "Conflicting Uncertain Multi-Path Task",
            "Multi-Path Multi-Outcome Task",
            "Uncertain Multi-Path Multi-Outcome Task",
            "Conflicting Multi-Path Multi-Outcome Task",
            "Maximally Complex Task (all attributes)"
    };

    public CampbellAttributes {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static int typeOf(boolean multiplePaths, boolean multipleOutcomes,
                             boolean conflictingInterdependence, UncertaintyLevel uncertaintyLevel) {
        int type = 0;
        if (multiplePaths) type |= PATHS_BIT;
        if (multipleOutcomes) type |= OUTCOMES_BIT;
        if (conflictingInterdependence) type |= CONFLICT_BIT;
        if (uncertaintyLevel != null && uncertaintyLevel.isPresent()) type |= UNCERTAINTY_BIT;
        return type;
    }

    public static String describeType(int campbellType) {
        if (campbellType < 0 || campbellType >= TYPE_DESCRIPTIONS.length) {
            return "Unknown Task Type";
        }
        return TYPE_DESCRIPTIONS[campbellType];
    }

    public String describeType() {
        return describeType(campbellType);
    }
}
