package com.flagship.ledger_service.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_service.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for account operations.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("surname")
    String surname;

    @JsonProperty("phone")
    String phone;

    @JsonProperty("date_of_birth")
    LocalDate dateOfBirth;

    @JsonProperty("place_of_birth")
    String placeOfBirth;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .accountNumber(account.getAccountNumber())
            .name(account.getHolder().getName())
            .surname(account.getHolder().getSurname())
            .phone(account.getHolder().getPhone())
            .dateOfBirth(account.getHolder().getDateOfBirth())
            .placeOfBirth(account.getHolder().getPlaceOfBirth())
            .balance(account.getBalance())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
