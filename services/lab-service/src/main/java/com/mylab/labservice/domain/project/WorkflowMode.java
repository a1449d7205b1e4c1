package com.mylab.labservice.domain.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Whether a project starts from analyses or from planned trials.
 */
public enum WorkflowMode implements WireEnum {

    ANALYSIS_FIRST("analysis_first"),
    TRIAL_FIRST("trial_first");

    private final String value;

    WorkflowMode(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowMode fromValue(String value) {
        return WireEnum.parse(WorkflowMode.class, value, "workflowMode");
    }
}
