package com.mylab.labservice.domain.project;

import java.time.Instant;
import java.util.UUID;

/**
 * Unit of work between a client and an executing organization. The client is either an
 * organization of the same workspace or a free-text external name, never both.
 */
public record Project(
        UUID id,
        UUID workspaceId,
        String name,
        String description,
        UUID clientOrgId,
        String clientOrgName,
        String externalClientName,
        UUID executingOrgId,
        String executingOrgName,
        WorkflowMode workflowMode,
        ProjectStatus status,
        String externalReference,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt) {
}
