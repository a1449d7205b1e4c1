package com.mylab.labservice.domain.batch;

import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import java.util.List;
import java.util.UUID;

public record NewBatch(
        String batchCode,
        String description,
        ExecutionMode executionMode,
        UUID executedByOrgId,
        String externalReference,
        List<UUID> sampleIds) {

    public void validate() {
        if (batchCode == null || batchCode.isBlank()) {
            throw new InvalidDataException("batchCode is required");
        }
        if (batchCode.length() > 100) {
            throw new InvalidDataException("batchCode must be at most 100 characters");
        }
        ExecutionMode.resolve(executionMode, externalReference);
        if (sampleIds != null && sampleIds.stream().distinct().count() != sampleIds.size()) {
            throw new InvalidDataException("sampleIds must not contain duplicates");
        }
    }
}
