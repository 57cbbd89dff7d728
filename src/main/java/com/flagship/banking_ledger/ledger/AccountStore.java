package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.ledger.exception.InvariantViolationException;
import com.flagship.banking_ledger.ledger.exception.LockContentionException;
import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import com.flagship.banking_ledger.reference.IdentifierGenerator;
import com.flagship.banking_ledger.reference.ReferenceDataLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Account rows and the only write path to their balances.
 *
 * Invariants:
 * 1. Balance is never negative (checked here and by the table's CHECK constraint)
 * 2. A balance changes only through {@link #applyDelta(long, long)}, which is visible to
 *    this package alone, i.e. to the transaction engine
 * 3. Every read that precedes a balance write goes through {@link #getForUpdate(long)}
 *
 * Plain JDBC, like the rest of the money path: the locking SQL is spelled out.
 */
@Service
@Slf4j
public class AccountStore {

    private static final String ACCOUNT_COLUMNS =
        "account_id, account_no, customer_id, branch_id, account_type_id, balance_minor, status, opened_at, closed_at";

    private final JdbcTemplate jdbcTemplate;
    private final ReferenceDataLookup referenceData;
    private final IdentifierGenerator identifiers;
    private final Clock clock;

    public AccountStore(JdbcTemplate jdbcTemplate, ReferenceDataLookup referenceData,
                        IdentifierGenerator identifiers, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.referenceData = referenceData;
        this.identifiers = identifiers;
        this.clock = clock;
    }

    /**
     * Creates an ACTIVE account with balance 0.
     *
     * @throws NotFoundException if the account type code is unknown
     */
    public Account open(long customerId, long branchId, String accountTypeCode) {
        long accountTypeId = referenceData.resolveAccountTypeId(accountTypeCode);
        long accountId = identifiers.nextAccountId();
        String accountNumber = identifiers.accountNumberFor(accountId);
        Instant openedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);

        jdbcTemplate.update(
            "INSERT INTO accounts (account_id, account_no, customer_id, branch_id, account_type_id, " +
            "balance_minor, status, opened_at) VALUES (?, ?, ?, ?, ?, 0, ?, ?)",
            accountId,
            accountNumber,
            customerId,
            branchId,
            accountTypeId,
            AccountStatus.ACTIVE.name(),
            Timestamp.from(openedAt)
        );

        log.debug("Inserted account {} ({}) of type {}", accountId, accountNumber, accountTypeCode);

        return new Account(accountId, accountNumber, customerId, branchId, accountTypeId,
            0L, AccountStatus.ACTIVE, openedAt, null);
    }

    /**
     * Reads balance and status and holds an exclusive lock on the row until the surrounding
     * transaction ends.
     *
     * @throws NotFoundException if the account does not exist
     * @throws LockContentionException if the lock is not granted within the lock timeout
     * @throws InvariantViolationException if called outside a transaction, where the lock
     *         would be released immediately
     */
    public LockedAccount getForUpdate(long accountId) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new InvariantViolationException(
                "getForUpdate called without an active transaction for account " + accountId);
        }

        List<LockedAccount> rows;
        try {
            rows = jdbcTemplate.query(
                "SELECT account_id, account_no, balance_minor, status FROM accounts WHERE account_id = ? FOR UPDATE",
                (rs, rowNum) -> new LockedAccount(
                    rs.getLong("account_id"),
                    rs.getString("account_no"),
                    rs.getLong("balance_minor"),
                    AccountStatus.valueOf(rs.getString("status"))
                ),
                accountId
            );
        } catch (PessimisticLockingFailureException e) {
            throw new LockContentionException("Could not lock account " + accountId, e);
        }

        if (rows.isEmpty()) {
            throw new NotFoundException("Account", accountId);
        }
        return rows.get(0);
    }

    /**
     * Adds a signed delta to the balance. Last-resort guard only: callers validate funds
     * before getting here.
     *
     * @throws InvariantViolationException if the balance would become negative or the
     *         account does not exist
     */
    void applyDelta(long accountId, long signedDelta) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance_minor = balance_minor + ? " +
            "WHERE account_id = ? AND balance_minor + ? >= 0",
            signedDelta,
            accountId,
            signedDelta
        );
        if (updated != 1) {
            throw new InvariantViolationException(String.format(
                "Balance delta %d rejected for account %d: result would be negative or account missing",
                signedDelta, accountId));
        }
    }

    /**
     * Writes a new status. Transition rules are checked by the caller under the row lock.
     */
    void updateStatus(long accountId, AccountStatus status, Instant closedAt) {
        jdbcTemplate.update(
            "UPDATE accounts SET status = ?, closed_at = ? WHERE account_id = ?",
            status.name(),
            closedAt != null ? Timestamp.from(closedAt) : null,
            accountId
        );
    }

    public Optional<Account> findById(long accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE account_id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    /**
     * Interest cohort candidates: ACTIVE accounts of the type with a positive balance, in
     * ascending id order. Read without locks; each one is re-checked once locked.
     */
    public List<Long> findCohortIds(long accountTypeId) {
        return jdbcTemplate.queryForList(
            "SELECT account_id FROM accounts " +
            "WHERE account_type_id = ? AND status = 'ACTIVE' AND balance_minor > 0 " +
            "ORDER BY account_id",
            Long.class,
            accountTypeId
        );
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp closedAt = rs.getTimestamp("closed_at");
            return new Account(
                rs.getLong("account_id"),
                rs.getString("account_no"),
                rs.getLong("customer_id"),
                rs.getLong("branch_id"),
                rs.getLong("account_type_id"),
                rs.getLong("balance_minor"),
                AccountStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("opened_at").toInstant(),
                closedAt != null ? closedAt.toInstant() : null
            );
        };
    }
}
