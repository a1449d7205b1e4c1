package com.mylab.security;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Validates decoded {@link SessionClaims}, collecting every error instead of stopping at the first.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    /**
     * Returns the violations found in {@code claims}; empty when the claims are usable.
     */
    public static List<String> validate(SessionClaims claims) {
        if (claims == null) {
            return List.of("claims must not be null");
        }
        List<String> errors = new ArrayList<>();

        if (!isUuid(claims.userId())) {
            errors.add("userId must be a UUID");
        }
        if (!isUuid(claims.workspaceId())) {
            errors.add("workspaceId must be a UUID");
        }
        if (!Role.isKnown(claims.role())) {
            errors.add("role '%s' is not a known role".formatted(claims.role()));
        }

        return List.copyOf(errors);
    }

    /**
     * Validates the claims and builds the caller context.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static LabSecurityContext toContext(SessionClaims claims, String token, String correlationId) {
        List<String> violations = validate(claims);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", violations));
        }
        return new LabSecurityContext(
                new AuthenticatedUser(UUID.fromString(claims.userId()), claims.email(), claims.displayName()),
                new WorkspaceContext(UUID.fromString(claims.workspaceId()), null),
                Role.fromString(claims.role()).orElseThrow(),
                token,
                correlationId);
    }

    private static boolean isUuid(String s) {
        if (s == null || s.isBlank()) {
            return false;
        }
        try {
            UUID.fromString(s);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
