package com.flagship.ledger_service.diagnostics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ConcurrencyStatus {

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("recent_transaction_count")
    long recentTransactionCount;

    @JsonProperty("window_seconds")
    long windowSeconds;

    @JsonProperty("lock_held")
    boolean lockHeld;
}
