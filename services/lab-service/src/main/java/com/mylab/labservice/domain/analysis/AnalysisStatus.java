package com.mylab.labservice.domain.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

public enum AnalysisStatus implements WireEnum {

    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static AnalysisStatus fromValue(String value) {
        return WireEnum.parse(AnalysisStatus.class, value, "status");
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(AnalysisStatus target) {
        if (isTerminal() || target == null || target == this) {
            return false;
        }
        return target.ordinal() > ordinal();
    }
}
