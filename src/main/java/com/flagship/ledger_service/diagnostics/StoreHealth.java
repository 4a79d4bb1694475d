package com.flagship.ledger_service.diagnostics;

import lombok.Value;

import java.time.Instant;

@Value
public class StoreHealth {
    boolean healthy;
    Instant checkedAt;
    String error;
}
