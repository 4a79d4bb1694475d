package com.flagship.ledger_service.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation ID handling for HTTP requests.
 *
 * The ID of the request being served lives in the SLF4J MDC under
 * {@link #CORRELATION_ID_MDC_KEY}, so every log line and every error body
 * produced on the request thread can carry it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_NUMBER_MDC_KEY = "accountNumber";

    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private CorrelationContext() {
    }

    /**
     * Returns the caller-supplied ID if it is safe to log, otherwise a fresh one.
     */
    public static String resolve(String headerValue) {
        if (headerValue != null && ACCEPTED_ID.matcher(headerValue).matches()) {
            return headerValue;
        }
        return generateCorrelationId();
    }

    /**
     * @return the ID bound to the current thread, or null outside a request
     */
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
