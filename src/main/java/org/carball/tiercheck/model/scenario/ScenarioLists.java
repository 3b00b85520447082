package org.carball.tiercheck.model.scenario;

import java.util.List;
import java.util.Objects;

/**
 * Normalizes list-valued scenario fields read from hand-written files.
 */
public final class ScenarioLists {

    private ScenarioLists() {
    }

    /**
     * Returns an unmodifiable copy without {@code null} entries; a {@code null} list becomes empty.
     */
    public static <T> List<T> compact(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
