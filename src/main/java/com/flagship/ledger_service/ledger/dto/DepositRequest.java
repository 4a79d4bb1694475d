package com.flagship.ledger_service.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for a deposit.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DepositRequest {

    @NotBlank(message = "Account number is required")
    @Pattern(regexp = "^\\d{8,12}$", message = "Account number must be 8 to 12 digits")
    @JsonProperty("account_number")
    private String accountNumber;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @DecimalMax(value = "1000000.00", message = "Amount must not exceed 1000000.00")
    @Digits(integer = 7, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    private BigDecimal amount;
}
