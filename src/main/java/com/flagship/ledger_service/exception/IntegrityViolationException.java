package com.flagship.ledger_service.exception;

/**
 * A database constraint rejected the unit of work at write or commit time.
 * The scope has been rolled back.
 */
public class IntegrityViolationException extends LedgerException {

    public IntegrityViolationException(String operation, Throwable cause) {
        super("INTEGRITY_VIOLATION", "Constraint violation while processing " + operation, cause);
    }
}
