package com.flagship.banking_ledger.reference;

import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads the reference tables replicated into the ledger database.
 */
@Component
public class JdbcReferenceDataLookup implements ReferenceDataLookup {

    private final JdbcTemplate jdbcTemplate;

    public JdbcReferenceDataLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long resolveAccountTypeId(String accountTypeCode) {
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT account_type_id FROM account_types WHERE code = ?",
            Long.class,
            accountTypeCode
        );
        if (ids.isEmpty()) {
            throw new NotFoundException("Account type", accountTypeCode);
        }
        return ids.get(0);
    }

    @Override
    public long resolveProductId(String productCode) {
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT product_id FROM loan_products WHERE code = ?",
            Long.class,
            productCode
        );
        if (ids.isEmpty()) {
            throw new NotFoundException("Loan product", productCode);
        }
        return ids.get(0);
    }

    @Override
    public Optional<LoanProduct> findProduct(long productId) {
        return jdbcTemplate.query(
            "SELECT product_id, code, name, annual_rate_bp, term_months FROM loan_products WHERE product_id = ?",
            loanProductRowMapper(),
            productId
        ).stream().findFirst();
    }

    private RowMapper<LoanProduct> loanProductRowMapper() {
        return (rs, rowNum) -> new LoanProduct(
            rs.getLong("product_id"),
            rs.getString("code"),
            rs.getString("name"),
            rs.getInt("annual_rate_bp"),
            rs.getInt("term_months")
        );
    }
}
