package com.mylab.labservice.domain.sample;

import com.mylab.labservice.domain.common.InvalidDataException;

public class SampleHasDerivedException extends InvalidDataException {

    public SampleHasDerivedException(long derivedCount) {
        super("SAMPLE_HAS_DERIVED",
                "Cannot delete sample with %d derived sample(s)".formatted(derivedCount));
    }
}
