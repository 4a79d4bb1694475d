package com.flagship.ledger_service.diagnostics;

import com.flagship.ledger_service.account.Account;
import com.flagship.ledger_service.account.AccountRepository;
import com.flagship.ledger_service.concurrency.AccountLockManager;
import com.flagship.ledger_service.concurrency.LedgerOperationExecutor;
import com.flagship.ledger_service.config.LedgerProperties;
import com.flagship.ledger_service.exception.AccountNotFoundException;
import com.flagship.ledger_service.ledger.MoneyUtil;
import com.flagship.ledger_service.ledger.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only introspection of the ledger engine.
 *
 * None of these queries take account locks, and lock flags are a snapshot
 * that may already be stale when returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagnosticsService {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final AccountLockManager lockManager;
    private final LedgerOperationExecutor operations;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Reports whether a transfer would currently pass the engine's checks.
     * The amount is rounded to cents first, the same way a transfer rounds it.
     */
    public TransferValidationReport validateTransferPreconditions(String fromAccount, String toAccount,
                                                                  BigDecimal amount) {
        return operations.read("validate-transfer", () -> {
            List<String> errors = new ArrayList<>();
            List<String> warnings = new ArrayList<>();

            if (fromAccount.equals(toAccount)) {
                errors.add("Source and destination accounts must be different");
            }
            BigDecimal normalized = amount == null ? null : MoneyUtil.format(amount);
            if (normalized == null || normalized.signum() <= 0) {
                errors.add("Transfer amount must be positive");
            }

            TransferValidationReport.AccountCheck from = check(fromAccount);
            TransferValidationReport.AccountCheck to = check(toAccount);
            if (!from.isExists()) {
                errors.add("Source account " + fromAccount + " not found");
            }
            if (!to.isExists()) {
                errors.add("Destination account " + toAccount + " not found");
            }

            boolean sufficient = from.isExists() && normalized != null
                    && from.getBalance().compareTo(normalized) >= 0;
            if (from.isExists() && normalized != null && !sufficient) {
                errors.add(String.format("Insufficient balance. Available: %s, Required: %s",
                        from.getBalance().toPlainString(), normalized.toPlainString()));
            }

            if (from.isLocked()) {
                warnings.add("Source account " + fromAccount + " is currently locked by another operation");
            }
            if (to.isLocked()) {
                warnings.add("Destination account " + toAccount + " is currently locked by another operation");
            }

            return TransferValidationReport.builder()
                    .valid(errors.isEmpty())
                    .errors(errors)
                    .warnings(warnings)
                    .sufficientFunds(sufficient)
                    .fromAccount(from)
                    .toAccount(to)
                    .build();
        });
    }

    /**
     * Transactions touching the account within the recent window, plus the lock flag.
     *
     * @throws AccountNotFoundException if the account does not exist
     */
    public ConcurrencyStatus getConcurrencyStatus(String accountNumber) {
        Duration window = properties.getDiagnostics().getRecentWindow();
        return operations.read("concurrency-status", () -> {
            if (!accountRepository.existsByAccountNumber(accountNumber)) {
                throw new AccountNotFoundException(accountNumber);
            }
            Instant since = clock.instant().minus(window);
            long recent = transactionRepository.countByAccountSince(accountNumber, since);
            return new ConcurrencyStatus(accountNumber, recent, window.toSeconds(),
                    lockManager.isLocked(accountNumber));
        });
    }

    /**
     * Connectivity check. Never throws; a failure is reported as unhealthy.
     */
    public StoreHealth checkStoreHealth() {
        Instant now = clock.instant();
        try {
            accountRepository.ping();
            return new StoreHealth(true, now, null);
        } catch (DataAccessException e) {
            log.warn("Ledger store health check failed: {}", e.getMessage());
            return new StoreHealth(false, now, e.getClass().getSimpleName());
        }
    }

    private TransferValidationReport.AccountCheck check(String accountNumber) {
        Optional<Account> account = accountRepository.findByAccountNumber(accountNumber);
        return new TransferValidationReport.AccountCheck(
                accountNumber,
                account.isPresent(),
                account.map(a -> MoneyUtil.format(a.getBalance())).orElse(null),
                lockManager.isLocked(accountNumber));
    }
}
