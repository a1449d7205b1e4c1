package com.mylab.security;

import java.util.UUID;

/**
 * Caller context passed explicitly into every service operation.
 *
 * @param user          authenticated user
 * @param workspace     workspace the caller acts in
 * @param role          the caller's role within that workspace
 * @param token         original bearer token
 * @param correlationId correlation ID of the request
 */
public record LabSecurityContext(
        AuthenticatedUser user,
        WorkspaceContext workspace,
        Role role,
        String token,
        String correlationId) {

    public UUID userId() {
        return user.userId();
    }

    public UUID workspaceId() {
        return workspace.workspaceId();
    }

    public boolean isPlatformAdmin() {
        return role == Role.PLATFORM_ADMIN;
    }

    public boolean actsIn(UUID workspaceId) {
        return workspace.workspaceId().equals(workspaceId);
    }
}
