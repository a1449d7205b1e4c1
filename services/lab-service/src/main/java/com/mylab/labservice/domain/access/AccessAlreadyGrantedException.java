package com.mylab.labservice.domain.access;

import com.mylab.labservice.domain.common.AlreadyExistsException;

public class AccessAlreadyGrantedException extends AlreadyExistsException {

    public AccessAlreadyGrantedException() {
        super("ACCESS_ALREADY_GRANTED", "Access already granted to this resource");
    }
}
