package com.flagship.ledger_service.account;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Generates unique 10-digit account numbers.
 *
 * Candidates are random with a non-zero leading digit and are checked against
 * the store. The unique constraint on {@code accounts.account_number} still
 * has the last word if two creations race for the same candidate.
 */
@Component
@Slf4j
public class AccountNumberGenerator {

    static final int LENGTH = 10;
    static final int MAX_ATTEMPTS = 100;

    private final AccountRepository accountRepository;
    private final SecureRandom random = new SecureRandom();

    public AccountNumberGenerator(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    public String nextAccountNumber() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = randomCandidate();
            if (!accountRepository.existsByAccountNumber(candidate)) {
                log.debug("Generated account number {} after {} attempt(s)", candidate, attempt + 1);
                return candidate;
            }
        }
        throw new IllegalStateException(
                "Could not generate a unique account number after " + MAX_ATTEMPTS + " attempts");
    }

    private String randomCandidate() {
        StringBuilder sb = new StringBuilder(LENGTH);
        sb.append(1 + random.nextInt(9));
        for (int i = 1; i < LENGTH; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }
}
