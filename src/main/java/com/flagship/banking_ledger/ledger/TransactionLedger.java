package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store of transaction records, one per balance-affecting event.
 *
 * There is no update or delete here, and the table's trigger rejects both.
 */
@Service
public class TransactionLedger {

    private static final String TXN_COLUMNS =
        "txn_id, account_id, txn_time, txn_type, amount_minor, related_account, reference, created_by, batch_id";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public TransactionLedger(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public LedgerTransaction append(long accountId, TransactionType type, long amount,
                                    Long counterpartyAccountId, String reference, String actor) {
        return append(accountId, type, amount, counterpartyAccountId, reference, actor, null);
    }

    /**
     * Appends one record and returns it with its assigned id.
     *
     * @throws InvalidAmountException if amount is not positive
     */
    public LedgerTransaction append(long accountId, TransactionType type, long amount,
                                    Long counterpartyAccountId, String reference, String actor,
                                    UUID batchId) {
        if (amount <= 0) {
            throw new InvalidAmountException("Transaction amount must be positive: " + amount);
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Long txnId = jdbcTemplate.queryForObject(
            "INSERT INTO account_transactions (account_id, txn_time, txn_type, amount_minor, related_account, " +
            "reference, created_by, batch_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING txn_id",
            Long.class,
            accountId,
            Timestamp.from(now),
            type.name(),
            amount,
            counterpartyAccountId,
            reference,
            actor,
            batchId
        );

        return new LedgerTransaction(txnId, accountId, now, type, amount,
            counterpartyAccountId, reference, actor, batchId);
    }

    /**
     * Sum of record amounts of one type for one account within one batch.
     */
    public long sumAmounts(long accountId, TransactionType type, UUID batchId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_minor), 0) FROM account_transactions " +
            "WHERE account_id = ? AND txn_type = ? AND batch_id = ?",
            Long.class,
            accountId,
            type.name(),
            batchId
        );
        return sum != null ? sum : 0L;
    }

    public List<LedgerTransaction> findByAccount(long accountId) {
        return jdbcTemplate.query(
            "SELECT " + TXN_COLUMNS + " FROM account_transactions WHERE account_id = ? ORDER BY txn_id",
            transactionRowMapper(),
            accountId
        );
    }

    public List<LedgerTransaction> findByBatch(UUID batchId) {
        return jdbcTemplate.query(
            "SELECT " + TXN_COLUMNS + " FROM account_transactions WHERE batch_id = ? ORDER BY txn_id",
            transactionRowMapper(),
            batchId
        );
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            long related = rs.getLong("related_account");
            Long counterparty = rs.wasNull() ? null : related;
            return new LedgerTransaction(
                rs.getLong("txn_id"),
                rs.getLong("account_id"),
                rs.getTimestamp("txn_time").toInstant(),
                TransactionType.valueOf(rs.getString("txn_type")),
                rs.getLong("amount_minor"),
                counterparty,
                rs.getString("reference"),
                rs.getString("created_by"),
                rs.getObject("batch_id", UUID.class)
            );
        };
    }
}
