package com.mylab.labservice.domain.common;

public class AlreadyExistsException extends LabException {

    public AlreadyExistsException(String message) {
        super("ALREADY_EXISTS", message);
    }

    protected AlreadyExistsException(String code, String message) {
        super(code, message);
    }
}
