package com.flagship.ledger_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the ledger engine, bound from the {@code ledger.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private final Lock lock = new Lock();
    private final Retry retry = new Retry();
    private final History history = new History();
    private final Diagnostics diagnostics = new Diagnostics();

    @Data
    public static class Lock {
        /** Maximum wait for exclusive access to one account. */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Retry {
        private int mutationMaxAttempts = 3;
        private int readMaxAttempts = 2;
        /** First backoff delay; doubled after every failed attempt. */
        private Duration baseDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class History {
        private int defaultLimit = 10;
        private int maxLimit = 100;
    }

    @Data
    public static class Diagnostics {
        /** Window used when counting recent transactions for an account. */
        private Duration recentWindow = Duration.ofSeconds(60);
    }
}
