package com.mylab.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Tenant roles carried by the caller's session.
 * <p>
 * The hierarchy is strictly linear: each role implies every role below it.
 * {@link #PLATFORM_ADMIN} is the only role that reaches outside the caller's workspace.
 */
public enum Role {

    VIEWER("viewer"),
    SCIENTIST("scientist"),
    MANAGER("manager"),
    ADMIN("admin"),
    PLATFORM_ADMIN("platform_admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The wire representation (e.g., "platform_admin"). */
    public String value() {
        return value;
    }

    /**
     * Returns the roles that this role implies, excluding itself.
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case PLATFORM_ADMIN -> EnumSet.of(ADMIN, MANAGER, SCIENTIST, VIEWER);
            case ADMIN -> EnumSet.of(MANAGER, SCIENTIST, VIEWER);
            case MANAGER -> EnumSet.of(SCIENTIST, VIEWER);
            case SCIENTIST -> EnumSet.of(VIEWER);
            case VIEWER -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether this role implies the given role, directly or through the hierarchy.
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * The access level a holder of this role has on resources of its own workspace
     * before any grant is considered.
     */
    public AccessLevel workspaceBaseline() {
        return switch (this) {
            case PLATFORM_ADMIN, ADMIN -> AccessLevel.FULL;
            case MANAGER, SCIENTIST -> AccessLevel.EDIT;
            case VIEWER -> AccessLevel.VIEW;
        };
    }

    /**
     * Looks up a Role by its wire value, ignoring case.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
