package com.scenariomock.core.model;

import java.util.Objects;

/**
 * Input for creating a {@link Scenario}.
 */
public class CreateScenario {

    private final String name;
    private final String provider;
    private String description;

    public CreateScenario(String name, String provider) {
        this.name = Objects.requireNonNull(name, "name");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public CreateScenario withDescription(String newDescription) {
        this.description = newDescription;
        return this;
    }

    public String getName() {
        return name;
    }

    public String getProvider() {
        return provider;
    }

    public String getDescription() {
        return description;
    }
}
