package com.mylab.labservice.domain.sample;

import com.mylab.labservice.domain.common.InvalidDataException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public record NewSample(
        UUID projectId,
        UUID trialId,
        String name,
        String description,
        String sampleType,
        BigDecimal quantity,
        String unit,
        Map<String, String> metadata) {

    public void validate() {
        if (projectId == null) {
            throw new InvalidDataException("projectId is required");
        }
        if (name == null || name.isBlank()) {
            throw new InvalidDataException("Sample name is required");
        }
        if (name.length() > 255) {
            throw new InvalidDataException("Sample name must be at most 255 characters");
        }
        if (quantity != null && quantity.signum() <= 0) {
            throw new InvalidDataException("quantity must be greater than zero");
        }
    }
}
