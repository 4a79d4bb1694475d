package com.flagship.ledger_service.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a committed transfer, with both balances as they stood right
 * after the commit.
 */
@Value
@Builder
public class TransferResult {
    String transferId;
    String fromAccount;
    String toAccount;
    BigDecimal amount;
    BigDecimal fromBalance;
    BigDecimal toBalance;
}
