package com.flagship.ledger_service.diagnostics;

import com.flagship.ledger_service.ledger.dto.TransferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DiagnosticsController {

    private final DiagnosticsService diagnosticsService;

    /**
     * Dry run of a transfer's checks. Always 200; failures are listed in the report.
     */
    @PostMapping("/transfers/validate")
    public ResponseEntity<TransferValidationReport> validateTransfer(@Valid @RequestBody TransferRequest request) {
        return ResponseEntity.ok(diagnosticsService.validateTransferPreconditions(
                request.getFromAccount(), request.getToAccount(), request.getAmount()));
    }

    @GetMapping("/accounts/{accountNumber}/concurrency-status")
    public ResponseEntity<ConcurrencyStatus> getConcurrencyStatus(@PathVariable String accountNumber) {
        return ResponseEntity.ok(diagnosticsService.getConcurrencyStatus(accountNumber));
    }
}
