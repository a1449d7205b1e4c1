package com.mylab.labservice.domain.common;

/**
 * Malformed or contradictory input. Raised before any write.
 */
public class InvalidDataException extends LabException {

    public InvalidDataException(String message) {
        super("INVALID_DATA", message);
    }

    protected InvalidDataException(String code, String message) {
        super(code, message);
    }
}
