package com.flagship.banking_ledger.interest;

import com.flagship.banking_ledger.ledger.InterestBatchResult;
import com.flagship.banking_ledger.ledger.TransactionEngine;
import com.flagship.banking_ledger.ledger.exception.LedgerException;
import com.flagship.banking_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Monthly interest run.
 *
 * Posts one batch per configured cohort. Each batch is its own transaction, so a cohort
 * that fails (unknown account type, lock contention) is logged and skipped while the
 * others still post. Nothing is retried here; the next run or an operator does that.
 */
@Component
@ConditionalOnProperty(name = "ledger.interest.scheduler.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class InterestBatchJob {

    static final String ACTOR = "INTEREST_JOB";

    private final TransactionEngine engine;
    private final InterestScheduleProperties properties;

    @Scheduled(cron = "${ledger.interest.cron:0 0 1 1 * *}")
    public void runScheduled() {
        runConfiguredBatches();
    }

    /**
     * @return results of the cohorts that posted
     */
    public List<InterestBatchResult> runConfiguredBatches() {
        CorrelationContext.setCorrelationId(null);
        try {
            List<InterestBatchResult> results = new ArrayList<>();
            for (InterestScheduleProperties.Schedule schedule : properties.schedules()) {
                try {
                    results.add(engine.postInterestBatch(
                        schedule.accountTypeCode(), schedule.annualRatePercent(), ACTOR));
                } catch (LedgerException e) {
                    log.error("Interest batch failed for account type {}: code={}, retryable={}, reason={}",
                        schedule.accountTypeCode(), e.getErrorCode(), e.isRetryable(), e.getMessage());
                }
            }
            log.info("Interest run finished: {} of {} cohorts posted",
                results.size(), properties.schedules().size());
            return results;
        } finally {
            CorrelationContext.clear();
        }
    }
}
