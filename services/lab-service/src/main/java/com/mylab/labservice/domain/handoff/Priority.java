package com.mylab.labservice.domain.handoff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

public enum Priority implements WireEnum {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    Priority(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static Priority fromValue(String value) {
        return WireEnum.parse(Priority.class, value, "priority");
    }

    /**
     * Sort key for listings, urgent first.
     */
    public int sortRank() {
        return values().length - 1 - ordinal();
    }
}
