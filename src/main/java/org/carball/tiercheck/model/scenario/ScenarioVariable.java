package org.carball.tiercheck.model.scenario;

import java.util.List;

/**
 * A named quantity in a scenario. {@code dependsOn} lists the variables it is computed from.
 */
public record ScenarioVariable(String name, String type, List<String> dependsOn) {

    public ScenarioVariable {
        dependsOn = ScenarioLists.compact(dependsOn);
    }

    public static ScenarioVariable of(String name, String type, String... dependsOn) {
        return new ScenarioVariable(name, type, List.of(dependsOn));
    }
}
