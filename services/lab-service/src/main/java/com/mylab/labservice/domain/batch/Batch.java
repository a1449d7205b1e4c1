package com.mylab.labservice.domain.batch;

import com.mylab.labservice.domain.common.ExecutionMode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Samples grouped for analysis, in submission order.
 */
public record Batch(
        UUID id,
        UUID workspaceId,
        String batchCode,
        String description,
        BatchStatus status,
        ExecutionMode executionMode,
        UUID executedByOrgId,
        String externalReference,
        List<UUID> sampleIds,
        Instant sentAt,
        Instant completedAt,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt) {

    public Batch {
        sampleIds = sampleIds == null ? List.of() : List.copyOf(sampleIds);
    }

    public int sampleCount() {
        return sampleIds.size();
    }

    public Batch withSampleIds(List<UUID> ids) {
        return new Batch(id, workspaceId, batchCode, description, status, executionMode, executedByOrgId,
                externalReference, ids, sentAt, completedAt, createdBy, createdAt, updatedAt);
    }
}
