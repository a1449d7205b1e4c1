package com.mylab.labservice.domain.workspace;

import com.mylab.labservice.domain.common.Lifecycle;
import java.time.Instant;
import java.util.UUID;

/**
 * Tenancy boundary. Every hierarchy record belongs to exactly one workspace.
 */
public record Workspace(
        UUID id,
        String name,
        UUID parentWorkspaceId,
        Lifecycle lifecycle,
        Instant createdAt) {
}
