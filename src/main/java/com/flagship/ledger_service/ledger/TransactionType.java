package com.flagship.ledger_service.ledger;

/**
 * Kind of mutation recorded in the transaction log.
 * WITHDRAWAL is part of the stored vocabulary but no operation produces it yet.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER
}
