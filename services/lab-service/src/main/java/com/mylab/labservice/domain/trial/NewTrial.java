package com.mylab.labservice.domain.trial;

import com.mylab.labservice.domain.common.InvalidDataException;
import java.time.Instant;
import java.util.Map;

public record NewTrial(
        String name,
        String objective,
        Map<String, String> parameterValues,
        String notes,
        TrialStatus status,
        Instant performedAt) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidDataException("Trial name is required");
        }
        if (name.length() > 255) {
            throw new InvalidDataException("Trial name must be at most 255 characters");
        }
        if (objective != null && objective.length() > 2000) {
            throw new InvalidDataException("Trial objective must be at most 2000 characters");
        }
    }
}
