package com.mylab.labservice.domain.sample;

import com.mylab.labservice.domain.common.InvalidDataException;
import java.math.BigDecimal;

/**
 * Partial update; null fields are left unchanged.
 */
public record SampleUpdate(
        String name,
        String description,
        String sampleType,
        BigDecimal quantity,
        String unit,
        String status) {

    public boolean isEmpty() {
        return name == null && description == null && sampleType == null && quantity == null
                && unit == null && status == null;
    }

    public void validate() {
        if (isEmpty()) {
            throw new InvalidDataException("No fields to update");
        }
        if (name != null && name.isBlank()) {
            throw new InvalidDataException("Sample name must not be blank");
        }
        if (quantity != null && quantity.signum() <= 0) {
            throw new InvalidDataException("quantity must be greater than zero");
        }
    }
}
