package com.flagship.banking_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Summary of one committed interest batch. The individual INTEREST records are
 * published as {@link TransactionPostedEvent}s carrying the same batch id.
 */
@Value
public class InterestBatchPostedEvent implements LedgerEvent {
    UUID eventId;
    UUID batchId;
    String accountTypeCode;
    BigDecimal annualRatePercent;
    int postings;
    long totalInterest;
    String actor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InterestBatchPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AggregateTypes.ACCOUNT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return accountTypeCode;
    }
}
