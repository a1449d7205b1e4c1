package com.mylab.labservice.domain.handoff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Listing filter relative to the caller's workspace.
 */
public enum Direction implements WireEnum {

    INCOMING("incoming"),
    OUTGOING("outgoing");

    private final String value;

    Direction(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static Direction fromValue(String value) {
        return WireEnum.parse(Direction.class, value, "direction");
    }
}
