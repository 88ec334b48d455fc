package com.topostat.core.model;

import java.util.Optional;

/**
 * Three-valued test outcome as carried on the wire.
 */
public enum Outcome {
    PASSED("passed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String wireValue;

    Outcome(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<Outcome> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Outcome outcome : values()) {
            if (outcome.wireValue.equals(value)) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }
}
