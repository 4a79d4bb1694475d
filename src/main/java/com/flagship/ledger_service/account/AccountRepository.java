package com.flagship.ledger_service.account;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC access to the {@code accounts} table.
 *
 * Balance updates are expressed as relative SQL updates so a mutation never
 * writes back a value it read earlier.
 */
@Repository
public class AccountRepository {

    private static final String SELECT_ACCOUNT =
            "SELECT id, account_number, holder_name, holder_surname, phone, date_of_birth, place_of_birth, "
                    + "balance, created_at, updated_at FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Account> findByAccountNumber(String accountNumber) {
        return jdbcTemplate.query(
                SELECT_ACCOUNT + "WHERE account_number = ?",
                accountRowMapper(),
                accountNumber
        ).stream().findFirst();
    }

    public boolean existsByAccountNumber(String accountNumber) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE account_number = ?",
                Integer.class,
                accountNumber
        );
        return count != null && count > 0;
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the account number
     *         or the holder's phone is already registered
     */
    public Account insert(String accountNumber, AccountHolder holder, Instant now) {
        jdbcTemplate.update(
                "INSERT INTO accounts (account_number, holder_name, holder_surname, phone, date_of_birth, "
                        + "place_of_birth, balance, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                accountNumber,
                holder.getName(),
                holder.getSurname(),
                holder.getPhone(),
                Date.valueOf(holder.getDateOfBirth()),
                holder.getPlaceOfBirth(),
                BigDecimal.ZERO.setScale(2),
                Timestamp.from(now),
                Timestamp.from(now)
        );
        return findByAccountNumber(accountNumber)
                .orElseThrow(() -> new IllegalStateException("Account vanished right after insert: " + accountNumber));
    }

    /**
     * @return true if the account exists and was credited
     */
    public boolean credit(String accountNumber, BigDecimal amount, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE accounts SET balance = balance + ?, updated_at = ? WHERE account_number = ?",
                amount,
                Timestamp.from(now),
                accountNumber
        );
        return updated == 1;
    }

    /**
     * Debits the account only if its current balance covers the amount.
     *
     * @return false if the guard did not match, in which case nothing changed
     */
    public boolean debit(String accountNumber, BigDecimal amount, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE accounts SET balance = balance - ?, updated_at = ? WHERE account_number = ? AND balance >= ?",
                amount,
                Timestamp.from(now),
                accountNumber,
                amount
        );
        return updated == 1;
    }

    /**
     * Trivial round trip used to check connectivity.
     */
    public void ping() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
                rs.getLong("id"),
                rs.getString("account_number"),
                AccountHolder.builder()
                        .name(rs.getString("holder_name"))
                        .surname(rs.getString("holder_surname"))
                        .phone(rs.getString("phone"))
                        .dateOfBirth(rs.getDate("date_of_birth").toLocalDate())
                        .placeOfBirth(rs.getString("place_of_birth"))
                        .build(),
                rs.getBigDecimal("balance"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
        );
    }
}
