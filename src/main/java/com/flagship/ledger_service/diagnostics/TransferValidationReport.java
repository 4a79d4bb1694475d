package com.flagship.ledger_service.diagnostics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Advisory pre-flight check for a prospective transfer. Nothing is reserved:
 * the picture may change before the transfer is actually submitted.
 */
@Value
@Builder
public class TransferValidationReport {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("errors")
    List<String> errors;

    @JsonProperty("warnings")
    List<String> warnings;

    @JsonProperty("sufficient_funds")
    boolean sufficientFunds;

    @JsonProperty("from_account")
    AccountCheck fromAccount;

    @JsonProperty("to_account")
    AccountCheck toAccount;

    @Value
    public static class AccountCheck {

        @JsonProperty("account_number")
        String accountNumber;

        @JsonProperty("exists")
        boolean exists;

        @JsonProperty("balance")
        BigDecimal balance;

        @JsonProperty("locked")
        boolean locked;
    }
}
