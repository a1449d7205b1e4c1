package com.mylab.security;

/**
 * Payload of a session token issued by the identity service.
 *
 * @param userId      user identifier (UUID string)
 * @param email       user's email
 * @param displayName optional display name
 * @param workspaceId workspace identifier (UUID string)
 * @param role        role wire value, see {@link Role#value()}
 */
public record SessionClaims(
        String userId,
        String email,
        String displayName,
        String workspaceId,
        String role) {
}
