package com.flagship.ledger_service.exception;

public class AccountNotFoundException extends LedgerException {

    private final String accountNumber;

    public AccountNotFoundException(String accountNumber) {
        super("ACCOUNT_NOT_FOUND", "Account " + accountNumber + " not found");
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
