package com.questrail.fasttest.api;

import java.util.Objects;

/**
 * Programmer-chosen identity of a scenario.
 * <p>
 * Two ids are the same scenario iff their names are equal. Names are
 * case-sensitive and must not be blank.
 */
public record ScenarioId(String name) {

    public ScenarioId {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Scenario name must not be blank");
        }
    }

    public static ScenarioId of(String name) {
        return new ScenarioId(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
