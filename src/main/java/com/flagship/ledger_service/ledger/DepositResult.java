package com.flagship.ledger_service.ledger;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class DepositResult {
    String accountNumber;
    BigDecimal newBalance;
    BigDecimal depositedAmount;
}
