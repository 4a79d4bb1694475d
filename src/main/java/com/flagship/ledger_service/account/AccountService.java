package com.flagship.ledger_service.account;

import com.flagship.ledger_service.concurrency.LedgerOperationExecutor;
import com.flagship.ledger_service.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Service for opening and looking up accounts.
 *
 * New accounts start with a zero balance; money only enters through deposits.
 * A holder can own only one account, keyed by phone number.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final AccountNumberGenerator accountNumberGenerator;
    private final LedgerOperationExecutor operations;
    private final Clock clock;

    /**
     * @throws com.flagship.ledger_service.exception.IntegrityViolationException
     *         if the holder's phone already belongs to an account
     */
    public Account createAccount(AccountHolder holder) {
        Account account = operations.mutate("create-account", List.of(), () ->
                accountRepository.insert(accountNumberGenerator.nextAccountNumber(), holder, clock.instant()));
        log.info("Created account {}", account.getAccountNumber());
        return account;
    }

    /**
     * @throws AccountNotFoundException if no account has this number
     */
    public Account getAccount(String accountNumber) {
        return operations.read("get-account", () ->
                accountRepository.findByAccountNumber(accountNumber)
                        .orElseThrow(() -> new AccountNotFoundException(accountNumber)));
    }
}
