package com.flagship.ledger_service.ledger;

import com.flagship.ledger_service.account.Account;
import com.flagship.ledger_service.account.AccountRepository;
import com.flagship.ledger_service.concurrency.LedgerOperationExecutor;
import com.flagship.ledger_service.exception.AccountNotFoundException;
import com.flagship.ledger_service.exception.InsufficientFundsException;
import com.flagship.ledger_service.exception.SameAccountException;
import com.flagship.ledger_service.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Moves funds between two accounts as a single atomic unit.
 *
 * Key principles:
 * - Both account locks are taken in lexicographic order of the account
 *   numbers, whatever the direction of the transfer. Two transfers over the
 *   same pair therefore queue on the same first lock and cannot deadlock.
 * - If the second lock times out, the first is released before the failure
 *   propagates.
 * - Debit, credit and the TRANSFER record commit together or not at all.
 * - Locks are released in reverse acquisition order after the commit, on
 *   every exit path.
 *
 * The debit is a guarded update ({@code balance >= amount}). Under the lock the
 * balance read just before cannot move through this service, but direct
 * administrative writes to the table can; the guard catches those.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    private static final String OPERATION = "transfer";

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final LedgerOperationExecutor operations;
    private final Clock clock;

    /**
     * Transfers funds from one account to another.
     *
     * @return transfer id, echoed amount and both balances after the commit
     * @throws SameAccountException if source and destination are the same; no lock is attempted
     * @throws IllegalArgumentException if the amount is not positive
     * @throws AccountNotFoundException if either account does not exist
     * @throws InsufficientFundsException if the source balance is below the amount
     * @throws com.flagship.ledger_service.exception.LockTimeoutException if either lock stays busy too long
     */
    public TransferResult transfer(String fromAccount, String toAccount, BigDecimal amount) {
        if (fromAccount.equals(toAccount)) {
            log.warn("Transfer rejected: source and destination are both {}", fromAccount);
            throw new SameAccountException(fromAccount);
        }
        BigDecimal transferAmount = MoneyUtil.requirePositive(amount, "Transfer");

        MDC.put(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY, fromAccount);
        try {
            TransferResult result = operations.mutate(OPERATION, lockOrder(fromAccount, toAccount),
                    () -> applyTransfer(fromAccount, toAccount, transferAmount));

            log.info("Transfer {} successful: {} from {} to {}",
                    result.getTransferId(), transferAmount, fromAccount, toAccount);
            return result;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }

    /**
     * Global lock order for a pair of accounts, independent of call direction.
     */
    static List<String> lockOrder(String first, String second) {
        return first.compareTo(second) <= 0
                ? List.of(first, second)
                : List.of(second, first);
    }

    private TransferResult applyTransfer(String fromAccount, String toAccount, BigDecimal amount) {
        Account source = accountRepository.findByAccountNumber(fromAccount)
                .orElseThrow(() -> new AccountNotFoundException(fromAccount));
        accountRepository.findByAccountNumber(toAccount)
                .orElseThrow(() -> new AccountNotFoundException(toAccount));

        if (source.getBalance().compareTo(amount) < 0) {
            throw new InsufficientFundsException(fromAccount, MoneyUtil.format(source.getBalance()), amount);
        }

        Instant now = clock.instant();
        if (!accountRepository.debit(fromAccount, amount, now)) {
            BigDecimal current = currentBalance(fromAccount);
            log.warn("Balance of {} changed outside the ledger: read {}, now {}",
                    fromAccount, source.getBalance(), current);
            throw new InsufficientFundsException(fromAccount, current, amount);
        }
        if (!accountRepository.credit(toAccount, amount, now)) {
            throw new AccountNotFoundException(toAccount);
        }
        transactionRepository.append(TransactionType.TRANSFER, fromAccount, toAccount, amount, now);

        return TransferResult.builder()
                .transferId(UUID.randomUUID().toString())
                .fromAccount(fromAccount)
                .toAccount(toAccount)
                .amount(amount)
                .fromBalance(currentBalance(fromAccount))
                .toBalance(currentBalance(toAccount))
                .build();
    }

    private BigDecimal currentBalance(String accountNumber) {
        return accountRepository.findByAccountNumber(accountNumber)
                .map(account -> MoneyUtil.format(account.getBalance()))
                .orElseThrow(() -> new AccountNotFoundException(accountNumber));
    }
}
