package com.mylab.labservice.domain.batch;

import com.mylab.labservice.domain.common.InvalidStateTransitionException;
import java.util.UUID;

/**
 * A batch cannot complete while some of its analyses are still pending or in progress.
 */
public class IncompleteBatchException extends InvalidStateTransitionException {

    public IncompleteBatchException(UUID batchId, long openAnalyses) {
        super("INCOMPLETE_BATCH",
                "Batch %s has %d analysis(es) not yet completed or failed".formatted(batchId, openAnalyses));
    }
}
