package com.flagship.banking_ledger.ledger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Bounds how long the current transaction waits for a row lock.
 *
 * Uses a transaction-local setting, so it ends with the commit or rollback and never
 * leaks to the next user of the pooled connection. A wait that runs out surfaces as
 * Postgres error 55P03, which the store translates into a retryable contention error.
 */
@Component
public class LockWaitPolicy {

    private final JdbcTemplate jdbcTemplate;
    private final long lockTimeoutMs;

    public LockWaitPolicy(JdbcTemplate jdbcTemplate,
                          @Value("${ledger.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Must be called inside the transaction it applies to.
     */
    public void apply() {
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            lockTimeoutMs + "ms"
        );
    }
}
