package com.mylab.labservice.domain.lineage;

import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.Lifecycle;
import com.mylab.labservice.domain.sample.SampleMetadata;
import java.time.Instant;
import java.util.UUID;

/**
 * A sample produced from a parent sample. Successive versions form a chain through
 * {@link #supersedesId()}; {@link #supersededById()} is null only on the live head.
 */
public record DerivedSample(
        UUID id,
        UUID workspaceId,
        UUID parentSampleId,
        String derivedCode,
        String name,
        String derivationMethod,
        ExecutionMode executionMode,
        UUID executedByOrgId,
        String externalReference,
        UUID supersedesId,
        UUID supersededById,
        SampleMetadata metadata,
        Lifecycle lifecycle,
        UUID createdBy,
        Instant createdAt) {

    public boolean isHead() {
        return supersededById == null;
    }
}
