package com.mylab.labservice.domain.common;

import java.util.UUID;

/**
 * The record being superseded is no longer the current one.
 */
public class StaleSupersessionException extends LabException {

    private final UUID predecessorId;

    public StaleSupersessionException(UUID predecessorId) {
        super("STALE_SUPERSESSION",
                "Analysis %s is no longer authoritative and cannot be superseded".formatted(predecessorId));
        this.predecessorId = predecessorId;
    }

    public UUID predecessorId() {
        return predecessorId;
    }
}
