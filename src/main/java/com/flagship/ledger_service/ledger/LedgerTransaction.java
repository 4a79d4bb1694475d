package com.flagship.ledger_service.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of one completed mutation.
 *
 * Deposits have no source account. Rows are appended once and never updated
 * or deleted.
 */
@Value
public class LedgerTransaction {
    Long id;
    String fromAccount;
    String toAccount;
    BigDecimal amount;
    TransactionType type;
    Instant createdAt;
}
