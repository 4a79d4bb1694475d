package com.flagship.ledger_service.concurrency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work inside a database transaction.
 *
 * On normal return the transaction is committed; a failed commit surfaces to
 * the caller. If the work throws, the transaction is rolled back and the very
 * same exception is rethrown.
 *
 * This only draws storage-transaction boundaries. Admission to the critical
 * section is the job of {@link AccountLockManager}, and the locks must be held
 * until this method has returned.
 */
@Component
@Slf4j
public class AtomicOperationExecutor {

    private final TransactionTemplate transactionTemplate;

    public AtomicOperationExecutor(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String description, Supplier<T> work) {
        log.debug("Starting atomic operation: {}", description);
        try {
            T result = transactionTemplate.execute(status -> work.get());
            log.debug("Atomic operation committed: {}", description);
            return result;
        } catch (RuntimeException | Error e) {
            log.debug("Atomic operation rolled back: {} ({})", description, e.getClass().getSimpleName());
            throw e;
        }
    }
}
