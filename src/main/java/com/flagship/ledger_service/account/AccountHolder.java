package com.flagship.ledger_service.account;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Personal details of the person an account belongs to.
 *
 * The phone number identifies the holder: no two accounts share one.
 */
@Value
@Builder
public class AccountHolder {
    String name;
    String surname;
    String phone;
    LocalDate dateOfBirth;
    String placeOfBirth;
}
