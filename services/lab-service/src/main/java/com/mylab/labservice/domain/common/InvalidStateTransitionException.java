package com.mylab.labservice.domain.common;

public class InvalidStateTransitionException extends LabException {

    public InvalidStateTransitionException(String entity, Object from, Object to) {
        super("INVALID_STATE_TRANSITION", "Cannot move %s from %s to %s".formatted(entity, from, to));
    }

    public InvalidStateTransitionException(String message) {
        super("INVALID_STATE_TRANSITION", message);
    }

    protected InvalidStateTransitionException(String code, String message) {
        super(code, message);
    }
}
