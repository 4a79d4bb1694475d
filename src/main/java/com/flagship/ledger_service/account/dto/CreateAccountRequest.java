package com.flagship.ledger_service.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_service.account.AccountHolder;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for opening an account.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(min = 2, max = 100, message = "Name must be 2 to 100 characters")
    @Pattern(regexp = "^[A-Za-z\\s'-]+$", message = "Name can only contain letters, spaces, hyphens and apostrophes")
    @JsonProperty("name")
    private String name;

    @NotBlank(message = "Surname is required")
    @Size(min = 2, max = 100, message = "Surname must be 2 to 100 characters")
    @Pattern(regexp = "^[A-Za-z\\s'-]+$", message = "Surname can only contain letters, spaces, hyphens and apostrophes")
    @JsonProperty("surname")
    private String surname;

    @NotBlank(message = "Phone is required")
    @Pattern(regexp = "^\\+[1-9]\\d{9,14}$", message = "Phone must be + followed by 10 to 15 digits")
    @JsonProperty("phone")
    private String phone;

    @NotNull(message = "Date of birth is required")
    @Past(message = "Date of birth must be in the past")
    @JsonProperty("date_of_birth")
    private LocalDate dateOfBirth;

    @NotBlank(message = "Place of birth is required")
    @Size(max = 100, message = "Place of birth must be at most 100 characters")
    @JsonProperty("place_of_birth")
    private String placeOfBirth;

    public AccountHolder toHolder() {
        return AccountHolder.builder()
            .name(name.trim())
            .surname(surname.trim())
            .phone(phone)
            .dateOfBirth(dateOfBirth)
            .placeOfBirth(placeOfBirth.trim())
            .build();
    }
}
