package com.mylab.labservice.domain.trial;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record Trial(
        UUID id,
        UUID workspaceId,
        UUID projectId,
        String name,
        String objective,
        Map<String, String> parameterValues,
        String notes,
        TrialStatus status,
        Instant performedAt,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt) {
}
