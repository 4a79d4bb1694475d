package com.flagship.ledger_service.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("balance")
    BigDecimal balance;
}
