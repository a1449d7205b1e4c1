package com.mylab.security.testing;

import com.mylab.security.AuthenticatedUser;
import com.mylab.security.LabSecurityContext;
import com.mylab.security.Role;
import com.mylab.security.SessionClaims;
import com.mylab.security.SessionTokenCodec;
import com.mylab.security.WorkspaceContext;

import java.util.UUID;

/**
 * Builds {@link LabSecurityContext} instances and bearer tokens for tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope
 * through a regular dependency.
 */
public final class TestSecurityContextFactory {

    private TestSecurityContextFactory() {
        // utility class
    }

    /**
     * A scientist in a fresh random workspace.
     */
    public static LabSecurityContext create() {
        return create(UUID.randomUUID(), UUID.randomUUID(), Role.SCIENTIST);
    }

    public static LabSecurityContext createWithRole(Role role) {
        return create(UUID.randomUUID(), UUID.randomUUID(), role);
    }

    public static LabSecurityContext createForWorkspace(UUID workspaceId, Role role) {
        return create(UUID.randomUUID(), workspaceId, role);
    }

    public static LabSecurityContext create(UUID userId, UUID workspaceId, Role role) {
        SessionClaims claims = claims(userId, workspaceId, role);
        return new LabSecurityContext(
                new AuthenticatedUser(userId, claims.email(), claims.displayName()),
                new WorkspaceContext(workspaceId, "Test Workspace"),
                role,
                SessionTokenCodec.encode(claims),
                "test-correlation-" + UUID.randomUUID());
    }

    /**
     * Authorization header value for the given context.
     */
    public static String bearer(LabSecurityContext context) {
        return "Bearer " + SessionTokenCodec.encode(
                claims(context.userId(), context.workspaceId(), context.role()));
    }

    private static SessionClaims claims(UUID userId, UUID workspaceId, Role role) {
        return new SessionClaims(
                userId.toString(), "user-" + userId + "@mylab.test", "Test User",
                workspaceId.toString(), role.value());
    }
}
