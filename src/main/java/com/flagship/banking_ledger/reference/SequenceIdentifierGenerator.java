package com.flagship.banking_ledger.reference;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Draws ids from database sequences. Account numbers are the configured prefix followed by
 * the zero-padded account id, so they are unique whenever the ids are.
 */
@Component
public class SequenceIdentifierGenerator implements IdentifierGenerator {

    private final JdbcTemplate jdbcTemplate;
    private final String accountNumberPrefix;

    public SequenceIdentifierGenerator(JdbcTemplate jdbcTemplate,
                                       @Value("${ledger.account-number-prefix:AC}") String accountNumberPrefix) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountNumberPrefix = accountNumberPrefix;
    }

    @Override
    public long nextAccountId() {
        return nextVal("account_id_seq");
    }

    @Override
    public String accountNumberFor(long accountId) {
        return accountNumberPrefix + String.format("%08d", accountId);
    }

    @Override
    public long nextLoanId() {
        return nextVal("loan_id_seq");
    }

    private long nextVal(String sequence) {
        Long value = jdbcTemplate.queryForObject("SELECT nextval('" + sequence + "')", Long.class);
        if (value == null) {
            throw new IllegalStateException("Sequence returned no value: " + sequence);
        }
        return value;
    }
}
