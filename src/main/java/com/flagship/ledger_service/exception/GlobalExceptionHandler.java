package com.flagship.ledger_service.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_service.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the ledger error taxonomy onto HTTP responses. Every body carries the
 * request's correlation ID when one is bound.
 *
 * Business rejections are 4xx and logged at warn. Store and internal failures
 * are 5xx (or 409 for constraint violations) and never expose their cause.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAccountNotFound(AccountNotFoundException e) {
        log.warn("Account not found: {}", e.getAccountNumber());
        return respond(HttpStatus.NOT_FOUND, "Account Not Found", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.warn("Insufficient funds: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Transfer Failed", e.getErrorCode(), e.getMessage(), Map.of(
                "available", e.getAvailable().toPlainString(),
                "required", e.getRequired().toPlainString()));
    }

    @ExceptionHandler(SameAccountException.class)
    public ResponseEntity<ErrorResponse> handleSameAccount(SameAccountException e) {
        log.warn("Same-account transfer rejected: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Transfer Failed", e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(LockTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleLockTimeout(LockTimeoutException e) {
        log.warn("Lock contention: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Account Busy", e.getErrorCode(),
                "Account " + e.getAccountNumber() + " is busy, please retry", null);
    }

    @ExceptionHandler(IntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityViolation(IntegrityViolationException e) {
        return respond(HttpStatus.CONFLICT, "Conflict", e.getErrorCode(),
                "The request conflicts with the current state of the ledger", null);
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<ErrorResponse> handleTransientStore(TransientStoreException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", e.getErrorCode(),
                "The ledger store is temporarily unavailable", null);
    }

    @ExceptionHandler(UnexpectedLedgerException.class)
    public ResponseEntity<ErrorResponse> handleUnexpectedLedger(UnexpectedLedgerException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", e.getErrorCode(),
                "An unexpected error occurred", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "VALIDATION_ERROR",
                "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "INVALID_REQUEST",
                "Request body is missing or malformed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "INVALID_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code,
                                                  String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .code(code)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.currentCorrelationId())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        @JsonProperty("error")
        String error;
        @JsonProperty("code")
        String code;
        @JsonProperty("message")
        String message;
        @JsonProperty("details")
        Map<String, String> details;
        @JsonProperty("correlation_id")
        String correlationId;
        @JsonProperty("timestamp")
        Instant timestamp;
    }
}
