package com.mylab.labservice.service;

import com.mylab.labservice.domain.access.AccessAlreadyGrantedException;
import com.mylab.labservice.domain.access.AccessGrant;
import com.mylab.labservice.domain.access.ObjectType;
import com.mylab.labservice.domain.common.InvalidDataException;
import com.mylab.labservice.domain.common.NotFoundException;
import com.mylab.labservice.infrastructure.persistence.AccessGrantRepository;
import com.mylab.labservice.infrastructure.persistence.ObjectOwnershipRepository;
import com.mylab.security.AccessLevel;
import com.mylab.security.LabSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * The access grant ledger. Grants are plain single-statement writes: granting never overwrites,
 * and a grant must be revoked before it can be issued again.
 *
 * <p>Managing grants on an object requires {@code full} on it.
 */
@Service
public class AccessGrantService {

    private static final Logger log = LoggerFactory.getLogger(AccessGrantService.class);

    private final AccessGrantRepository grants;
    private final ObjectOwnershipRepository ownership;
    private final AuthorizationService authorization;
    private final Clock clock;

    public AccessGrantService(AccessGrantRepository grants, ObjectOwnershipRepository ownership,
                              AuthorizationService authorization, Clock clock) {
        this.grants = grants;
        this.ownership = ownership;
        this.authorization = authorization;
        this.clock = clock;
    }

    /**
     * @throws AccessAlreadyGrantedException when the user already holds a grant on the object
     */
    public AccessGrant grant(LabSecurityContext context, UUID userId, ObjectType objectType, UUID objectId,
                             AccessLevel level) {
        requireCoordinate(userId, objectType, objectId);
        if (level == null) {
            throw new InvalidDataException("accessLevel is required");
        }
        authorizeManagement(context, objectType, objectId);

        Instant now = clock.instant();
        AccessGrant grant = new AccessGrant(UUID.randomUUID(), userId, objectType, objectId, level,
                context.userId(), now, now);
        try {
            grants.insert(grant);
        } catch (DuplicateKeyException e) {
            throw new AccessAlreadyGrantedException();
        }
        log.info("Granted {} on {} {} to user {}", level.value(), objectType.value(), objectId, userId);
        return grant;
    }

    /**
     * All grants on the object, newest first. Not filtered by workspace: collaborators from other
     * workspaces appear here.
     */
    public List<AccessGrant> list(LabSecurityContext context, ObjectType objectType, UUID objectId) {
        UUID owner = owner(objectType, objectId);
        authorization.authorize(context, objectType, objectId, owner, AccessLevel.VIEW);
        return grants.listByObject(objectType, objectId);
    }

    public Optional<AccessLevel> getUserAccess(LabSecurityContext context, UUID userId, ObjectType objectType,
                                               UUID objectId) {
        UUID owner = owner(objectType, objectId);
        authorization.authorize(context, objectType, objectId, owner, AccessLevel.VIEW);
        return grants.findLevel(userId, objectType, objectId);
    }

    /**
     * Changes the level of an existing grant.
     *
     * @throws NotFoundException when no grant exists for the coordinate
     */
    public AccessGrant updateLevel(LabSecurityContext context, UUID userId, ObjectType objectType, UUID objectId,
                                   AccessLevel level) {
        requireCoordinate(userId, objectType, objectId);
        if (level == null) {
            throw new InvalidDataException("accessLevel is required");
        }
        authorizeManagement(context, objectType, objectId);
        if (grants.updateLevel(userId, objectType, objectId, level, clock.instant()) == 0) {
            throw grantNotFound(userId, objectType, objectId);
        }
        log.info("Changed access of user {} on {} {} to {}", userId, objectType.value(), objectId, level.value());
        return grants.find(userId, objectType, objectId)
                .orElseThrow(() -> grantNotFound(userId, objectType, objectId));
    }

    /**
     * Deletes the grant. Revoking twice fails the second time.
     *
     * @throws NotFoundException when no grant exists for the coordinate
     */
    public void revoke(LabSecurityContext context, UUID userId, ObjectType objectType, UUID objectId) {
        requireCoordinate(userId, objectType, objectId);
        authorizeManagement(context, objectType, objectId);
        if (grants.delete(userId, objectType, objectId) == 0) {
            throw grantNotFound(userId, objectType, objectId);
        }
        log.info("Revoked access of user {} on {} {}", userId, objectType.value(), objectId);
    }

    private void authorizeManagement(LabSecurityContext context, ObjectType objectType, UUID objectId) {
        authorization.authorize(context, objectType, objectId, owner(objectType, objectId), AccessLevel.FULL);
    }

    private UUID owner(ObjectType objectType, UUID objectId) {
        return ownership.findWorkspaceId(objectType, objectId)
                .orElseThrow(() -> new NotFoundException(AuthorizationService.label(objectType), objectId));
    }

    private static void requireCoordinate(UUID userId, ObjectType objectType, UUID objectId) {
        if (userId == null || objectType == null || objectId == null) {
            throw new InvalidDataException("userId, objectType and objectId are required");
        }
    }

    private static NotFoundException grantNotFound(UUID userId, ObjectType objectType, UUID objectId) {
        return new NotFoundException("Access grant", "%s/%s/%s".formatted(userId, objectType.value(), objectId));
    }
}
