package com.mylab.labservice.domain.common;

/**
 * Root of the lab service's error taxonomy. Each subclass maps to one HTTP status.
 */
public abstract class LabException extends RuntimeException {

    private final String code;

    protected LabException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected LabException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Stable machine-readable error code (e.g., "NOT_FOUND"). */
    public String code() {
        return code;
    }
}
