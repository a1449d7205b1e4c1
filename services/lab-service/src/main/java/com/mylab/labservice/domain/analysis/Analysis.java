package com.mylab.labservice.domain.analysis;

import com.mylab.labservice.domain.common.ExecutionMode;
import java.time.Instant;
import java.util.UUID;

/**
 * One analytical result for one sample within one batch. For a given sample and analysis type at
 * most one analysis is authoritative; a newer one takes over through {@link #supersedesId()}.
 */
public record Analysis(
        UUID id,
        UUID workspaceId,
        UUID batchId,
        UUID sampleId,
        String analysisType,
        AnalysisStatus status,
        AnalysisResults results,
        String filePath,
        String checksum,
        ExecutionMode executionMode,
        String externalReference,
        Instant performedAt,
        boolean authoritative,
        UUID supersedesId,
        int revisionNumber,
        UUID uploadedBy,
        UUID editedBy,
        Instant createdAt,
        Instant updatedAt) {
}
