package com.mylab.labservice.domain.handoff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.mylab.labservice.domain.common.WireEnum;

/**
 * Supply-chain request states: {@code pending -> accepted -> in_progress -> completed}, with
 * {@code rejected} reachable only from {@code pending}. {@code completed} and {@code rejected}
 * are terminal.
 */
public enum HandoffStatus implements WireEnum {

    PENDING("pending"),
    ACCEPTED("accepted"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    REJECTED("rejected");

    private final String value;

    HandoffStatus(String value) {
        this.value = value;
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @JsonCreator
    public static HandoffStatus fromValue(String value) {
        return WireEnum.parse(HandoffStatus.class, value, "status");
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED;
    }

    public boolean canTransitionTo(HandoffStatus target) {
        return switch (this) {
            case PENDING -> target == ACCEPTED || target == REJECTED;
            case ACCEPTED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED;
            case COMPLETED, REJECTED -> false;
        };
    }
}
