package com.mylab.labservice.domain.common;

/**
 * No database connection could be acquired within the configured timeout. Safe to retry.
 */
public class ResourceExhaustedException extends LabException {

    public ResourceExhaustedException(String message, Throwable cause) {
        super("RESOURCE_EXHAUSTED", message, cause);
    }
}
