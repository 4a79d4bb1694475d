package com.flagship.ledger_service.exception;

/**
 * Wraps any failure that is neither a business rejection nor a known store
 * condition. The message is generic; details stay in the logs.
 */
public class UnexpectedLedgerException extends LedgerException {

    public UnexpectedLedgerException(String operation, Throwable cause) {
        super("INTERNAL_ERROR", "Failed to process " + operation, cause);
    }
}
