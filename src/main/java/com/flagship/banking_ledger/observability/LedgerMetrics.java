package com.flagship.banking_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for ledger and loan operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter tagged by operation and outcome ("success" or the error code)
 * - ledger.operations.latency: timer tagged by operation
 * - ledger.interest.postings: counter of INTEREST records written, tagged by account type
 * - ledger.fee.capped: counter of fees whose debit was capped at the available balance
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome, long durationMs) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("ledger.operations.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordInterestPostings(String accountTypeCode, int postings) {
        registry.counter("ledger.interest.postings",
                "account_type", sanitizeTag(accountTypeCode)
        ).increment(postings);
    }

    public void recordFeeCapped() {
        registry.counter("ledger.fee.capped").increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
