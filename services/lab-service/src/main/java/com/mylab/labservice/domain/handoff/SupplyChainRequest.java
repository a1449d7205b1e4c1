package com.mylab.labservice.domain.handoff;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Cross-organization handoff of material or analysis responsibility.
 *
 * @param workspaceId     initiator's workspace
 * @param toWorkspaceId   receiver's workspace
 * @param linkedProjectId project created in the receiver's workspace on acceptance, if any
 * @param linkedSampleId  sample created in that project on acceptance, if any
 */
public record SupplyChainRequest(
        UUID id,
        UUID workspaceId,
        UUID toWorkspaceId,
        UUID fromOrgId,
        UUID toOrgId,
        UUID fromProjectId,
        WorkflowType workflowType,
        MaterialDescriptor material,
        String requirements,
        HandoffStatus status,
        Priority priority,
        LocalDate dueDate,
        UUID assignedTo,
        String notes,
        String rejectionReason,
        String resultSummary,
        UUID linkedProjectId,
        UUID linkedSampleId,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt) {
}
