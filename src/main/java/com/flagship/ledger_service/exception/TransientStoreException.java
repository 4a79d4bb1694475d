package com.flagship.ledger_service.exception;

/**
 * The store kept failing with connectivity or timeout errors after the
 * retry budget was spent. The cause is the last failure observed.
 */
public class TransientStoreException extends LedgerException {

    private final int attempts;

    public TransientStoreException(String operation, int attempts, Throwable cause) {
        super("STORE_UNAVAILABLE",
                String.format("Store unavailable for %s after %d attempts", operation, attempts), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
