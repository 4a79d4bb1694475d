package com.flagship.ledger_service.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_service.ledger.DepositResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    @JsonProperty("deposited_amount")
    BigDecimal depositedAmount;

    public static DepositResponse from(DepositResult result) {
        return DepositResponse.builder()
            .success(true)
            .accountNumber(result.getAccountNumber())
            .newBalance(result.getNewBalance())
            .depositedAmount(result.getDepositedAmount())
            .build();
    }
}
