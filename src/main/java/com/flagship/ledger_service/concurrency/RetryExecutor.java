package com.flagship.ledger_service.concurrency;

import com.flagship.ledger_service.config.LedgerProperties;
import com.flagship.ledger_service.exception.TransientStoreException;
import com.flagship.ledger_service.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Retries store operations that fail for transient reasons.
 *
 * Transient means the store could not be reached or did not answer in time:
 * lost or unobtainable connections, query timeouts, deadlock victims. Those
 * are retried with exponential backoff ({@code baseDelay * 2^attempt}) until
 * the attempt budget is spent, after which the last failure is surfaced as a
 * {@link TransientStoreException}.
 *
 * Anything else propagates unchanged on the first failure: constraint
 * violations, business rejections, lock timeouts and programming errors.
 */
@Component
@Slf4j
public class RetryExecutor {

    static final List<Class<? extends Throwable>> TRANSIENT_FAILURES = List.of(
            TransientDataAccessException.class,
            RecoverableDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class
    );

    private static final String OPERATION_ATTRIBUTE = "ledger.operation";

    private final LedgerProperties.Retry settings;
    private final LedgerMetrics metrics;
    private final Map<Integer, RetryTemplate> templates = new ConcurrentHashMap<>();

    public RetryExecutor(LedgerProperties properties, LedgerMetrics metrics) {
        this.settings = properties.getRetry();
        this.metrics = metrics;
    }

    /**
     * Runs the operation, making at most {@code maxAttempts} attempts in total.
     */
    public <T> T execute(String operation, int maxAttempts, Supplier<T> action) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        RetryTemplate template = templates.computeIfAbsent(maxAttempts, this::buildTemplate);

        return template.execute(
                context -> {
                    context.setAttribute(OPERATION_ATTRIBUTE, operation);
                    return action.get();
                },
                context -> {
                    Throwable last = context.getLastThrowable();
                    if (isTransient(last)) {
                        log.error("{} failed after {} attempts, giving up", operation, context.getRetryCount(), last);
                        throw new TransientStoreException(operation, context.getRetryCount(), last);
                    }
                    throw propagate(last);
                });
    }

    public static boolean isTransient(Throwable failure) {
        if (failure == null) {
            return false;
        }
        for (Class<? extends Throwable> type : TRANSIENT_FAILURES) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    private RetryTemplate buildTemplate(int maxAttempts) {
        long baseDelay = Math.max(1L, settings.getBaseDelay().toMillis());
        long maxDelay = Math.max(baseDelay + 1, settings.getMaxDelay().toMillis());

        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(baseDelay, 2.0, maxDelay)
                .withListener(new TransientFailureListener(maxAttempts));
        TRANSIENT_FAILURES.forEach(builder::retryOn);
        return builder.build();
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(failure);
    }

    private class TransientFailureListener implements RetryListener {

        private final int maxAttempts;

        TransientFailureListener(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            if (!isTransient(throwable) || context.getRetryCount() >= maxAttempts) {
                return;
            }
            String operation = (String) context.getAttribute(OPERATION_ATTRIBUTE);
            metrics.recordRetry(operation);
            log.warn("{} failed on attempt {}/{}, retrying: {}",
                    operation, context.getRetryCount(), maxAttempts, throwable.getMessage());
        }
    }
}
