package com.mylab.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Merges the caller's tenant role with an access grant into one effective access level.
 * <ul>
 *   <li>{@link Role#PLATFORM_ADMIN}: {@link AccessLevel#FULL} on everything</li>
 *   <li>same workspace: the role baseline, raised by a stronger grant</li>
 *   <li>foreign workspace: the grant alone</li>
 * </ul>
 */
public final class CapabilityResolver {

    private CapabilityResolver() {
        // utility class
    }

    /**
     * Resolves the caller's effective level on a resource.
     *
     * @param context             the caller
     * @param resourceWorkspaceId workspace owning the resource
     * @param grant               the caller's grant on the resource, if any
     * @return the effective level, or empty when the caller has no access at all
     */
    public static Optional<AccessLevel> resolve(
            LabSecurityContext context, UUID resourceWorkspaceId, Optional<AccessLevel> grant) {
        if (context.isPlatformAdmin()) {
            return Optional.of(AccessLevel.FULL);
        }
        AccessLevel fromGrant = grant.orElse(null);
        if (context.actsIn(resourceWorkspaceId)) {
            return Optional.of(AccessLevel.strongest(context.role().workspaceBaseline(), fromGrant));
        }
        return Optional.ofNullable(fromGrant);
    }

    /**
     * Whether the resolved level satisfies {@code required}.
     */
    public static boolean permits(
            LabSecurityContext context, UUID resourceWorkspaceId, Optional<AccessLevel> grant,
            AccessLevel required) {
        return resolve(context, resourceWorkspaceId, grant)
                .map(level -> level.implies(required))
                .orElse(false);
    }
}
