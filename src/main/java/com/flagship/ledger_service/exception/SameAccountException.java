package com.flagship.ledger_service.exception;

public class SameAccountException extends LedgerException {

    public SameAccountException(String accountNumber) {
        super("SAME_ACCOUNT", "Cannot transfer from account " + accountNumber + " to itself");
    }

    @Override
    public boolean isBusinessRejection() {
        return true;
    }
}
