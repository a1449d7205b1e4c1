package com.mylab.labservice.domain.common;

public class ForbiddenException extends LabException {

    public ForbiddenException(String message) {
        super("FORBIDDEN", message);
    }
}
