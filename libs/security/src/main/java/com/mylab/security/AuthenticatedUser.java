package com.mylab.security;

import java.util.UUID;

/**
 * The user behind a request, as asserted by the upstream identity service.
 *
 * @param userId      unique user identifier
 * @param email       user's email address
 * @param displayName optional human-readable name
 */
public record AuthenticatedUser(UUID userId, String email, String displayName) {
}
