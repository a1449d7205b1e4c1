package com.mylab.labservice.domain.handoff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Kind of handoff, fixed at creation.
 */
public enum WorkflowType implements WireEnum {

    ANALYSIS_ONLY("analysis_only"),
    MATERIAL_TRANSFER("material_transfer"),
    PRODUCT_CONTINUATION("product_continuation"),
    SUPPLY_CHAIN("supply_chain");

    private final String value;

    WorkflowType(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowType fromValue(String value) {
        return WireEnum.parse(WorkflowType.class, value, "workflowType");
    }

    /**
     * Whether accepting the request creates a project and sample in the receiving workspace.
     */
    public boolean createsReceivingRecords() {
        return this == MATERIAL_TRANSFER || this == SUPPLY_CHAIN;
    }

    /**
     * Whether the request must describe the material being handed over.
     */
    public boolean requiresMaterial() {
        return this != ANALYSIS_ONLY;
    }
}
