package com.mylab.labservice.domain.common;

public class UnauthenticatedException extends LabException {

    public UnauthenticatedException(String message) {
        super("UNAUTHENTICATED", message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super("UNAUTHENTICATED", message, cause);
    }
}
