package com.mylab.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Capability levels recorded in the access grant ledger, ordered from weakest to strongest.
 */
public enum AccessLevel {

    VIEW("view"),
    EDIT("edit"),
    FULL("full");

    private final String value;

    AccessLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Whether this level satisfies a requirement of {@code required}.
     */
    public boolean implies(AccessLevel required) {
        return compareTo(required) >= 0;
    }

    /**
     * Returns the stronger of two levels; either argument may be null.
     */
    public static AccessLevel strongest(AccessLevel a, AccessLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Strict lookup used when reading JSON.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static AccessLevel fromValue(String value) {
        return fromString(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown access level '%s'".formatted(value)));
    }

    public static Optional<AccessLevel> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AccessLevel level : values()) {
            if (level.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
