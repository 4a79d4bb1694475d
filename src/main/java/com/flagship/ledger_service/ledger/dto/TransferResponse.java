package com.flagship.ledger_service.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_service.ledger.TransferResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO for a committed transfer.
 */
@Value
@Builder
public class TransferResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("transfer_id")
    String transferId;

    @JsonProperty("from_account")
    String fromAccount;

    @JsonProperty("to_account")
    String toAccount;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("from_balance")
    BigDecimal fromBalance;

    @JsonProperty("to_balance")
    BigDecimal toBalance;

    public static TransferResponse from(TransferResult result) {
        return TransferResponse.builder()
            .success(true)
            .transferId(result.getTransferId())
            .fromAccount(result.getFromAccount())
            .toAccount(result.getToAccount())
            .amount(result.getAmount())
            .fromBalance(result.getFromBalance())
            .toBalance(result.getToBalance())
            .build();
    }
}
