package com.flagship.ledger_service.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_service.ledger.LedgerTransaction;
import com.flagship.ledger_service.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Recent transactions for one account, newest first.
 */
@Value
@Builder
public class TransactionHistoryResponse {

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("count")
    int count;

    @JsonProperty("transactions")
    List<Entry> transactions;

    public static TransactionHistoryResponse from(String accountNumber, List<LedgerTransaction> history) {
        List<Entry> entries = history.stream()
            .map(Entry::from)
            .toList();
        return TransactionHistoryResponse.builder()
            .accountNumber(accountNumber)
            .count(entries.size())
            .transactions(entries)
            .build();
    }

    @Value
    @Builder
    public static class Entry {
        @JsonProperty("id")
        Long id;
        @JsonProperty("from_account")
        String fromAccount;
        @JsonProperty("to_account")
        String toAccount;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("transaction_type")
        TransactionType type;
        @JsonProperty("created_at")
        Instant createdAt;

        static Entry from(LedgerTransaction transaction) {
            return Entry.builder()
                .id(transaction.getId())
                .fromAccount(transaction.getFromAccount())
                .toAccount(transaction.getToAccount())
                .amount(transaction.getAmount())
                .type(transaction.getType())
                .createdAt(transaction.getCreatedAt())
                .build();
        }
    }
}
