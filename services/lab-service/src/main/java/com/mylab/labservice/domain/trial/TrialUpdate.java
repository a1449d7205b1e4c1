package com.mylab.labservice.domain.trial;

import java.time.Instant;
import java.util.Map;

/**
 * Partial update; null fields are left unchanged.
 */
public record TrialUpdate(
        String name,
        String objective,
        Map<String, String> parameterValues,
        String notes,
        TrialStatus status,
        Instant performedAt) {

    public boolean isEmpty() {
        return name == null && objective == null && parameterValues == null && notes == null
                && status == null && performedAt == null;
    }
}
