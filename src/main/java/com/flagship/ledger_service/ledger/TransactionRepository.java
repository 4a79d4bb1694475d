package com.flagship.ledger_service.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/**
 * Append-only JDBC access to the {@code transactions} table.
 * Rows are never updated or deleted.
 */
@Repository
public class TransactionRepository {

    private final JdbcTemplate jdbcTemplate;

    public TransactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public LedgerTransaction append(TransactionType type, String fromAccount, String toAccount,
                                    BigDecimal amount, Instant createdAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    "INSERT INTO transactions (from_account, to_account, amount, transaction_type, created_at) " +
                    "VALUES (?, ?, ?, ?, ?)",
                    new String[] {"id"});
            if (fromAccount == null) {
                ps.setNull(1, Types.VARCHAR);
            } else {
                ps.setString(1, fromAccount);
            }
            ps.setString(2, toAccount);
            ps.setBigDecimal(3, amount);
            ps.setString(4, type.name());
            ps.setTimestamp(5, Timestamp.from(createdAt));
            return ps;
        }, keyHolder);

        Number id = keyHolder.getKey();
        return new LedgerTransaction(id != null ? id.longValue() : null,
                fromAccount, toAccount, amount, type, createdAt);
    }

    /**
     * Transactions touching the account as source or destination, most recent first.
     */
    public List<LedgerTransaction> findRecentByAccount(String accountNumber, int limit) {
        return jdbcTemplate.query(
                "SELECT id, from_account, to_account, amount, transaction_type, created_at " +
                "FROM transactions WHERE from_account = ? OR to_account = ? " +
                "ORDER BY created_at DESC, id DESC LIMIT ?",
                transactionRowMapper(),
                accountNumber,
                accountNumber,
                limit
        );
    }

    public long countByAccountSince(String accountNumber, Instant since) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transactions " +
                "WHERE (from_account = ? OR to_account = ?) AND created_at >= ?",
                Long.class,
                accountNumber,
                accountNumber,
                Timestamp.from(since)
        );
        return count != null ? count : 0L;
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
                rs.getLong("id"),
                rs.getString("from_account"),
                rs.getString("to_account"),
                rs.getBigDecimal("amount"),
                TransactionType.valueOf(rs.getString("transaction_type")),
                rs.getTimestamp("created_at").toInstant()
        );
    }
}
