package com.flagship.ledger_service.ledger;

import com.flagship.ledger_service.account.Account;
import com.flagship.ledger_service.account.AccountRepository;
import com.flagship.ledger_service.concurrency.LedgerOperationExecutor;
import com.flagship.ledger_service.exception.AccountNotFoundException;
import com.flagship.ledger_service.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Credits a single account.
 *
 * The balance change and its DEPOSIT record are written in one transaction
 * while the account lock is held, so they are committed together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositService {

    private static final String OPERATION = "deposit";

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final LedgerOperationExecutor operations;
    private final Clock clock;

    /**
     * Deposits funds into an account.
     *
     * @param accountNumber destination account
     * @param amount amount to credit, must be positive
     * @return the new balance together with the credited amount
     * @throws IllegalArgumentException if the amount is not positive
     * @throws AccountNotFoundException if the account does not exist
     * @throws com.flagship.ledger_service.exception.LockTimeoutException if the account stays locked too long
     */
    public DepositResult deposit(String accountNumber, BigDecimal amount) {
        BigDecimal depositAmount = MoneyUtil.requirePositive(amount, "Deposit");

        MDC.put(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY, accountNumber);
        try {
            DepositResult result = operations.mutate(OPERATION, List.of(accountNumber),
                    () -> applyDeposit(accountNumber, depositAmount));

            log.info("Deposit of {} successful, new balance {}", depositAmount, result.getNewBalance());
            return result;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }

    private DepositResult applyDeposit(String accountNumber, BigDecimal amount) {
        Account account = accountRepository.findByAccountNumber(accountNumber)
                .orElseThrow(() -> new AccountNotFoundException(accountNumber));

        Instant now = clock.instant();
        if (!accountRepository.credit(accountNumber, amount, now)) {
            throw new AccountNotFoundException(accountNumber);
        }
        transactionRepository.append(TransactionType.DEPOSIT, null, accountNumber, amount, now);

        BigDecimal newBalance = accountRepository.findByAccountNumber(accountNumber)
                .map(Account::getBalance)
                .orElseThrow(() -> new AccountNotFoundException(accountNumber));

        log.debug("Credited {} to {}: {} -> {}", amount, accountNumber, account.getBalance(), newBalance);
        return new DepositResult(accountNumber, MoneyUtil.format(newBalance), amount);
    }
}
