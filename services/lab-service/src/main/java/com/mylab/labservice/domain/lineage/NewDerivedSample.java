package com.mylab.labservice.domain.lineage;

import com.mylab.labservice.domain.common.ExecutionMode;
import com.mylab.labservice.domain.common.InvalidDataException;
import java.util.Map;
import java.util.UUID;

/**
 * @param supersedesId optional current head of the lineage this record replaces
 */
public record NewDerivedSample(
        String derivedCode,
        String name,
        String derivationMethod,
        ExecutionMode executionMode,
        UUID executedByOrgId,
        String externalReference,
        UUID supersedesId,
        Map<String, String> metadata) {

    public void validate() {
        if (derivedCode == null || derivedCode.isBlank()) {
            throw new InvalidDataException("derivedCode is required");
        }
        if (derivedCode.length() > 100) {
            throw new InvalidDataException("derivedCode must be at most 100 characters");
        }
        if (name == null || name.isBlank()) {
            throw new InvalidDataException("Derived sample name is required");
        }
        ExecutionMode.resolve(executionMode, externalReference);
    }
}
