package com.mylab.labservice.domain.batch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Batch lifecycle. Forward order is {@code created < in_progress < ready < sent < completed};
 * {@code failed} is reachable from any non-terminal state. Nothing leaves a terminal state.
 */
public enum BatchStatus implements WireEnum {

    CREATED("created"),
    IN_PROGRESS("in_progress"),
    READY("ready"),
    SENT("sent"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    BatchStatus(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static BatchStatus fromValue(String value) {
        return WireEnum.parse(BatchStatus.class, value, "status");
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Analyses may only be submitted before the batch is sent.
     */
    public boolean acceptsAnalyses() {
        return this == CREATED || this == IN_PROGRESS || this == READY;
    }

    /**
     * Samples may only be added before the batch is ready.
     */
    public boolean acceptsSamples() {
        return this == CREATED || this == IN_PROGRESS;
    }

    /**
     * Strictly forward moves in the fixed order, or to {@code failed} from a non-terminal state.
     */
    public boolean canTransitionTo(BatchStatus target) {
        if (isTerminal() || target == null || target == this) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return target.ordinal() > ordinal();
    }
}
