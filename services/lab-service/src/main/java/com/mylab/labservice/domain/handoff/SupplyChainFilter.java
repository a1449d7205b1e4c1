package com.mylab.labservice.domain.handoff;

/**
 * Optional listing filters; null means "any".
 */
public record SupplyChainFilter(Direction direction, HandoffStatus status, WorkflowType workflowType) {

    public static SupplyChainFilter none() {
        return new SupplyChainFilter(null, null, null);
    }
}
