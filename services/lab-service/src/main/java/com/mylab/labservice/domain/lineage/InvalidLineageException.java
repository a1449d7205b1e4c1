package com.mylab.labservice.domain.lineage;

import com.mylab.labservice.domain.common.AlreadyExistsException;

/**
 * A supersession would give a lineage a second live head.
 */
public class InvalidLineageException extends AlreadyExistsException {

    public InvalidLineageException(String message) {
        super("INVALID_LINEAGE", message);
    }
}
