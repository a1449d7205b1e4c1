package com.mylab.labservice.domain.trial;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

public enum TrialStatus implements WireEnum {

    PLANNED("planned"),
    RUNNING("running"),
    COMPLETED("completed");

    private final String value;

    TrialStatus(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static TrialStatus fromValue(String value) {
        return WireEnum.parse(TrialStatus.class, value, "status");
    }
}
