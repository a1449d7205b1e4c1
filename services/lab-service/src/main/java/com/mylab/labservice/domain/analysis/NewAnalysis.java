package com.mylab.labservice.domain.analysis;

import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import java.time.Instant;
import java.util.UUID;

/**
 * @param authoritative whether a fresh analysis claims authority; ignored when superseding, since
 *                      the successor always inherits it
 * @param supersedesId  optional authoritative analysis this one replaces
 */
public record NewAnalysis(
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
        UUID supersedesId) {

    public void validate() {
        if (batchId == null) {
            throw new InvalidDataException("batchId is required");
        }
        if (sampleId == null) {
            throw new InvalidDataException("sampleId is required");
        }
        if (analysisType == null || analysisType.isBlank()) {
            throw new InvalidDataException("analysisType is required");
        }
        if (analysisType.length() > 100) {
            throw new InvalidDataException("analysisType must be at most 100 characters");
        }
        ExecutionMode.resolve(executionMode, externalReference);
    }

    public boolean supersedes() {
        return supersedesId != null;
    }
}
