package com.flagship.ledger_service.health;

import com.flagship.ledger_service.concurrency.AccountLockManager;
import com.flagship.ledger_service.diagnostics.DiagnosticsService;
import com.flagship.ledger_service.diagnostics.StoreHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the ledger store, with the number of account locks held
 * at the time of the check.
 */
@Component("ledgerStore")
public class LedgerStoreHealthIndicator implements HealthIndicator {

    private final DiagnosticsService diagnosticsService;
    private final AccountLockManager lockManager;

    public LedgerStoreHealthIndicator(DiagnosticsService diagnosticsService, AccountLockManager lockManager) {
        this.diagnosticsService = diagnosticsService;
        this.lockManager = lockManager;
    }

    @Override
    public Health health() {
        StoreHealth store = diagnosticsService.checkStoreHealth();
        Health.Builder builder = store.isHealthy() ? Health.up() : Health.down();
        if (store.getError() != null) {
            builder.withDetail("error", store.getError());
        }
        return builder
                .withDetail("lockedAccounts", lockManager.lockedAccounts().size())
                .withDetail("checkedAt", store.getCheckedAt().toString())
                .build();
    }
}
