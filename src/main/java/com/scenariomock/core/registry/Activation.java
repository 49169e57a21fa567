package com.scenariomock.core.registry;

import java.util.Optional;

/**
 * The active scenario as seen at one point in time. {@code generation} changes on every
 * activation and deactivation, so counts taken under an older generation can be told apart.
 *
 * @param scenario   active scenario name, or null when none is active
 * @param generation activation generation
 */
public record Activation(String scenario, long generation) {

    public Optional<String> activeScenario() {
        return Optional.ofNullable(scenario);
    }
}
