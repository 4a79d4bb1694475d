package com.flagship.ledger_service.ledger;

import com.flagship.ledger_service.account.Account;
import com.flagship.ledger_service.account.AccountRepository;
import com.flagship.ledger_service.concurrency.LedgerOperationExecutor;
import com.flagship.ledger_service.config.LedgerProperties;
import com.flagship.ledger_service.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read side of the ledger. Reads take no locks and may trail a mutation that
 * is still in flight.
 */
@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final LedgerOperationExecutor operations;
    private final LedgerProperties properties;

    /**
     * @throws AccountNotFoundException if the account does not exist
     */
    public BigDecimal getBalance(String accountNumber) {
        return operations.read("get-balance", () ->
                accountRepository.findByAccountNumber(accountNumber)
                        .map(Account::getBalance)
                        .map(MoneyUtil::format)
                        .orElseThrow(() -> new AccountNotFoundException(accountNumber)));
    }

    /**
     * Most recent transactions touching the account, newest first.
     *
     * @param limit requested page size; clamped to {@code 1..ledger.history.max-limit}
     * @throws AccountNotFoundException if the account does not exist
     */
    public List<LedgerTransaction> getHistory(String accountNumber, int limit) {
        int effectiveLimit = clampLimit(limit);
        return operations.read("get-history", () -> {
            if (!accountRepository.existsByAccountNumber(accountNumber)) {
                throw new AccountNotFoundException(accountNumber);
            }
            return transactionRepository.findRecentByAccount(accountNumber, effectiveLimit);
        });
    }

    int clampLimit(int limit) {
        int maxLimit = properties.getHistory().getMaxLimit();
        if (limit < 1) {
            return Math.min(properties.getHistory().getDefaultLimit(), maxLimit);
        }
        return Math.min(limit, maxLimit);
    }
}
