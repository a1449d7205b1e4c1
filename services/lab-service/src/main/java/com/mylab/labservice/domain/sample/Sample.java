package com.mylab.labservice.domain.sample;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record Sample(
        UUID id,
        UUID workspaceId,
        UUID projectId,
        UUID trialId,
        String name,
        String description,
        String sampleType,
        BigDecimal quantity,
        String unit,
        String status,
        SampleMetadata metadata,
        String externalReference,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt) {

    public static final String DEFAULT_STATUS = "active";
}
