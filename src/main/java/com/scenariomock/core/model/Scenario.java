package com.scenariomock.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A named, provider-tagged bundle of mocked requests.
 *
 * <p>{@link #isActive()} is informational only; the scenario used for matching is tracked by
 * {@link com.scenariomock.core.registry.ScenarioRegistry}.
 */
public class Scenario {

    private final long id;
    private final String name;
    private final String provider;
    private final String description;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    @JsonCreator
    public Scenario(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("provider") String provider,
            @JsonProperty("description") String description,
            @JsonProperty("active") boolean active,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("updatedAt") Instant updatedAt) {
        this.id = id;
        this.name = name;
        this.provider = provider;
        this.description = description;
        this.active = active;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Returns a copy with the active flag changed and {@code updatedAt} bumped.
     */
    public Scenario withActive(boolean newActive, Instant now) {
        return new Scenario(id, name, provider, description, newActive, createdAt, now);
    }

    public long getId() {
        return id;
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

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "Scenario{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", provider='" + provider + '\'' +
                ", active=" + active +
                '}';
    }
}
