package com.flagship.ledger_service.exception;

import java.time.Duration;

/**
 * Raised when an account lock could not be obtained in time.
 *
 * Signals contention rather than an infrastructure fault, so the retry
 * harness reports it straight away instead of retrying.
 */
public class LockTimeoutException extends LedgerException {

    private final String accountNumber;

    public LockTimeoutException(String accountNumber, Duration timeout) {
        super("LOCK_TIMEOUT", String.format(
                "Could not lock account %s within %d ms", accountNumber, timeout.toMillis()));
        this.accountNumber = accountNumber;
    }

    public LockTimeoutException(String accountNumber, InterruptedException cause) {
        super("LOCK_TIMEOUT", "Interrupted while waiting for lock on account " + accountNumber, cause);
        this.accountNumber = accountNumber;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    @Override
    public boolean isBusinessRejection() {
        return true;
    }
}
