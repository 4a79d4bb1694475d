package com.flagship.ledger_service.ledger;

import com.flagship.ledger_service.ledger.dto.DepositRequest;
import com.flagship.ledger_service.ledger.dto.DepositResponse;
import com.flagship.ledger_service.ledger.dto.TransferRequest;
import com.flagship.ledger_service.ledger.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for balance-changing operations.
 *
 * Validation of the request shape happens here; every business rule is
 * enforced by the services under the account locks.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final DepositService depositService;
    private final TransferService transferService;

    @PostMapping("/deposits")
    public ResponseEntity<DepositResponse> deposit(@Valid @RequestBody DepositRequest request) {
        log.info("Received deposit request: account={}, amount={}",
                request.getAccountNumber(), request.getAmount());

        DepositResult result = depositService.deposit(request.getAccountNumber(), request.getAmount());
        return ResponseEntity.ok(DepositResponse.from(result));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> transfer(@Valid @RequestBody TransferRequest request) {
        log.info("Received transfer request: from={}, to={}, amount={}",
                request.getFromAccount(), request.getToAccount(), request.getAmount());

        TransferResult result = transferService.transfer(
                request.getFromAccount(), request.getToAccount(), request.getAmount());
        return ResponseEntity.ok(TransferResponse.from(result));
    }
}
