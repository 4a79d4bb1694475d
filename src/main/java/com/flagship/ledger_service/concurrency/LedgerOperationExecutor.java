package com.flagship.ledger_service.concurrency;

import com.flagship.ledger_service.config.LedgerProperties;
import com.flagship.ledger_service.exception.IntegrityViolationException;
import com.flagship.ledger_service.exception.LedgerException;
import com.flagship.ledger_service.exception.UnexpectedLedgerException;
import com.flagship.ledger_service.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

/**
 * Composes the retry harness, the account locks and the atomic scope around
 * a plain ledger function.
 *
 * For a mutation the layering is, outermost first:
 * <pre>
 *   retry (mutation budget)
 *     acquire account locks in the given order
 *       transaction: read, check, mutate, append, commit
 *     release account locks in reverse order
 * </pre>
 * The locks enclose the whole transaction so that the next holder of a lock
 * always reads committed state.
 *
 * Failures coming out of the stack are translated once, here:
 * {@link LedgerException}s pass through, constraint violations become
 * {@link IntegrityViolationException}, anything else is logged in full and
 * wrapped in {@link UnexpectedLedgerException}.
 */
@Component
@Slf4j
public class LedgerOperationExecutor {

    private final RetryExecutor retryExecutor;
    private final AtomicOperationExecutor atomicExecutor;
    private final AccountLockManager lockManager;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    public LedgerOperationExecutor(RetryExecutor retryExecutor,
                                   AtomicOperationExecutor atomicExecutor,
                                   AccountLockManager lockManager,
                                   LedgerProperties properties,
                                   LedgerMetrics metrics) {
        this.retryExecutor = retryExecutor;
        this.atomicExecutor = atomicExecutor;
        this.lockManager = lockManager;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Runs a balance-changing unit of work while holding the locks of the
     * given accounts, acquired in exactly the order supplied.
     */
    public <T> T mutate(String operation, List<String> lockOrder, Supplier<T> work) {
        int maxAttempts = properties.getRetry().getMutationMaxAttempts();
        return translate(operation, () ->
                retryExecutor.execute(operation, maxAttempts, () -> lockedAtomic(operation, lockOrder, work)));
    }

    /**
     * Runs a read-only lookup with the read retry budget and no locks.
     */
    public <T> T read(String operation, Supplier<T> query) {
        int maxAttempts = properties.getRetry().getReadMaxAttempts();
        return translate(operation, () -> retryExecutor.execute(operation, maxAttempts, query));
    }

    private <T> T lockedAtomic(String operation, List<String> lockOrder, Supplier<T> work) {
        lockManager.acquireAll(lockOrder, properties.getLock().getTimeout());
        try {
            return atomicExecutor.execute(operation, work);
        } finally {
            lockManager.releaseAll(lockOrder);
        }
    }

    private <T> T translate(String operation, Supplier<T> call) {
        try {
            T result = metrics.time(operation, call);
            metrics.recordOutcome(operation, "success");
            return result;
        } catch (LedgerException e) {
            metrics.recordOutcome(operation, e.getErrorCode());
            if (e.isBusinessRejection()) {
                log.warn("{} rejected: {}", operation, e.getMessage());
            }
            throw e;
        } catch (DataIntegrityViolationException e) {
            metrics.recordOutcome(operation, "integrity_violation");
            log.error("{} violated a store constraint and was rolled back", operation, e);
            throw new IntegrityViolationException(operation, e);
        } catch (RuntimeException e) {
            metrics.recordOutcome(operation, "internal_error");
            log.error("{} failed unexpectedly and was rolled back", operation, e);
            throw new UnexpectedLedgerException(operation, e);
        }
    }
}
