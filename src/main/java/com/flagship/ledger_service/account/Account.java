package com.flagship.ledger_service.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Domain model for an Account.
 *
 * The account number and holder profile are fixed at creation. The balance
 * is only mutated by deposits and transfers, under the account lock.
 */
@Value
public class Account {
    Long id;
    String accountNumber;
    AccountHolder holder;
    BigDecimal balance;
    Instant createdAt;
    Instant updatedAt;
}
