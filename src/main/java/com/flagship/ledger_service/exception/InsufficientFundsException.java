package com.flagship.ledger_service.exception;

import java.math.BigDecimal;

/**
 * Thrown when the source account cannot cover a debit.
 * Nothing has been mutated when this is raised.
 */
public class InsufficientFundsException extends LedgerException {

    private final String accountNumber;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(String accountNumber, BigDecimal available, BigDecimal required) {
        super("INSUFFICIENT_FUNDS", String.format(
                "Insufficient balance in account %s. Available: %s, Required: %s",
                accountNumber, available.toPlainString(), required.toPlainString()));
        this.accountNumber = accountNumber;
        this.available = available;
        this.required = required;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequired() {
        return required;
    }

    @Override
    public boolean isBusinessRejection() {
        return true;
    }
}
