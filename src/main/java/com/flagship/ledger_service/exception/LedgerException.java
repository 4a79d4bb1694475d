package com.flagship.ledger_service.exception;

/**
 * Base class for every failure the ledger engine reports to its callers.
 *
 * Each subclass carries a stable error code that is returned to API clients
 * and used as the outcome tag on metrics.
 */
public abstract class LedgerException extends RuntimeException {

    private final String errorCode;

    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Business rejections are expected outcomes: they are never retried and
     * never logged above warning level.
     */
    public boolean isBusinessRejection() {
        return false;
    }
}
