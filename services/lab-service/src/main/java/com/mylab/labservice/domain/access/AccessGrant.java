package com.mylab.labservice.domain.access;

import com.mylab.security.AccessLevel;
import java.time.Instant;
import java.util.UUID;

/**
 * Explicit capability of one user on one object. Unique per (user, object type, object id).
 */
public record AccessGrant(
        UUID id,
        UUID userId,
        ObjectType objectType,
        UUID objectId,
        AccessLevel accessLevel,
        UUID grantedBy,
        Instant createdAt,
        Instant updatedAt) {
}
