package com.mylab.labservice.domain.organization;

import com.mylab.labservice.domain.common.Lifecycle;
import java.time.Instant;
import java.util.UUID;

/**
 * A named party inside a workspace, referenced by projects as client or executing party.
 */
public record Organization(
        UUID id,
        UUID workspaceId,
        String name,
        OrganizationType type,
        ContactInfo contactInfo,
        Lifecycle lifecycle,
        Instant createdAt,
        Instant updatedAt) {
}
