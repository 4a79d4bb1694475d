package com.flagship.ledger_service.account;

import com.flagship.ledger_service.account.dto.AccountResponse;
import com.flagship.ledger_service.account.dto.BalanceResponse;
import com.flagship.ledger_service.account.dto.CreateAccountRequest;
import com.flagship.ledger_service.ledger.LedgerQueryService;
import com.flagship.ledger_service.ledger.dto.TransactionHistoryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for accounts and their read-side views.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerQueryService queryService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(request.toHolder());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{accountNumber}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable String accountNumber) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(accountNumber)));
    }

    @GetMapping("/{accountNumber}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String accountNumber) {
        return ResponseEntity.ok(new BalanceResponse(accountNumber, queryService.getBalance(accountNumber)));
    }

    /**
     * Recent transactions, newest first. Out-of-range limits are clamped, not rejected.
     */
    @GetMapping("/{accountNumber}/transactions")
    public ResponseEntity<TransactionHistoryResponse> getHistory(
            @PathVariable String accountNumber,
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        log.debug("History requested for {} with limit {}", accountNumber, limit);
        return ResponseEntity.ok(TransactionHistoryResponse.from(accountNumber,
                queryService.getHistory(accountNumber, limit)));
    }
}
