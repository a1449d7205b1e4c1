package com.mylab.labservice.infrastructure.persistence;

import com.mylab.labservice.domain.common.ResourceExhaustedException;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs multi-statement work in one transaction. Any exception rolls the whole unit back.
 */
@Component
public class TransactionRunner {

    private final TransactionTemplate template;

    public TransactionRunner(PlatformTransactionManager transactionManager) {
        this.template = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws ResourceExhaustedException when no connection could be acquired in time
     */
    public <T> T inTransaction(Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (CannotCreateTransactionException e) {
            throw new ResourceExhaustedException("Database connection unavailable, retry later", e);
        }
    }

    public void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
