package com.mylab.labservice.domain.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where work was carried out. External work must carry an external reference.
 */
public enum ExecutionMode implements WireEnum {

    PLATFORM("platform"),
    EXTERNAL("external");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static ExecutionMode fromValue(String value) {
        return WireEnum.parse(ExecutionMode.class, value, "executionMode");
    }

    /**
     * Checks that external work names its external reference.
     */
    public static ExecutionMode resolve(ExecutionMode requested, String externalReference) {
        ExecutionMode mode = requested != null ? requested : PLATFORM;
        if (mode == EXTERNAL && (externalReference == null || externalReference.isBlank())) {
            throw new InvalidDataException("externalReference is required when executionMode is external");
        }
        return mode;
    }
}
