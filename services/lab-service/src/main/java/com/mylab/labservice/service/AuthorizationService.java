package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.ForbiddenException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.infrastructure.persistence.AccessGrantRepository;
import com.mylab.security.AccessLevel;
import com.mylab.security.CapabilityResolver;
import com.mylab.security.LabSecurityContext;
import com.mylab.security.Role;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Single authorization decision per operation: the caller's role merged with their grant on the
 * object, resolved by {@link CapabilityResolver}.
 */
@Service
public class AuthorizationService {

    private final AccessGrantRepository grants;

    public AuthorizationService(AccessGrantRepository grants) {
        this.grants = grants;
    }

    /**
     * Resolves the caller's effective level on an object, reading the grant ledger at most once.
     */
    public Optional<AccessLevel> resolve(
            LabSecurityContext context, ObjectType objectType, UUID objectId, UUID ownerWorkspaceId) {
        Optional<AccessLevel> grant = context.isPlatformAdmin()
                ? Optional.empty()
                : grants.findLevel(context.userId(), objectType, objectId);
        return CapabilityResolver.resolve(context, ownerWorkspaceId, grant);
    }

    /**
     * Requires {@code required} on the object.
     *
     * @throws NotFoundException  when the caller cannot see the object at all, so foreign objects
     *                            stay indistinguishable from missing ones
     * @throws ForbiddenException when the caller can see it but holds a weaker level
     */
    public AccessLevel authorize(
            LabSecurityContext context, ObjectType objectType, UUID objectId, UUID ownerWorkspaceId,
            AccessLevel required) {
        AccessLevel level = resolve(context, objectType, objectId, ownerWorkspaceId)
                .orElseThrow(() -> new NotFoundException(label(objectType), objectId));
        if (!level.implies(required)) {
            throw new ForbiddenException("%s access to %s %s requires %s".formatted(
                    level.value(), objectType.value(), objectId, required.value()));
        }
        return level;
    }

    public boolean canView(LabSecurityContext context, ObjectType objectType, UUID objectId, UUID ownerWorkspaceId) {
        return resolve(context, objectType, objectId, ownerWorkspaceId).isPresent();
    }

    /**
     * Requires a role baseline in the caller's own workspace, for creating new records there.
     */
    public void requireWorkspace(LabSecurityContext context, AccessLevel required) {
        if (!CapabilityResolver.permits(context, context.workspaceId(), Optional.empty(), required)) {
            throw new ForbiddenException("Role %s cannot create records in this workspace"
                    .formatted(context.role().value()));
        }
    }

    public void requireRole(LabSecurityContext context, Role required, String action) {
        if (!context.role().implies(required)) {
            throw new ForbiddenException("Only %s users can %s".formatted(required.value(), action));
        }
    }

    static String label(ObjectType objectType) {
        return switch (objectType) {
            case PROJECT -> "Project";
            case TRIAL -> "Trial";
            case SAMPLE -> "Sample";
            case DERIVED_SAMPLE -> "Derived sample";
            case BATCH -> "Batch";
            case ANALYSIS -> "Analysis";
            case ORGANIZATION -> "Organization";
            case SUPPLY_CHAIN_REQUEST -> "Supply chain request";
        };
    }
}
