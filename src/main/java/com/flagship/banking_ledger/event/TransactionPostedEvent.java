package com.flagship.banking_ledger.event;

import com.flagship.banking_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every transaction record appended to an account.
 *
 * A transfer produces two of these, one per side, each keyed by its own account.
 */
@Value
public class TransactionPostedEvent implements LedgerEvent {
    UUID eventId;
    long transactionId;
    long accountId;
    String transactionType;
    long amount;
    Long counterpartyAccountId;
    String reference;
    String actor;
    UUID batchId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AggregateTypes.ACCOUNT;
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(accountId);
    }

    public static TransactionPostedEvent fromTransaction(LedgerTransaction txn) {
        return new TransactionPostedEvent(
            UUID.randomUUID(),
            txn.getId(),
            txn.getAccountId(),
            txn.getType().name(),
            txn.getAmount(),
            txn.getCounterpartyAccountId(),
            txn.getReference(),
            txn.getActor(),
            txn.getBatchId(),
            txn.getTimestamp()
        );
    }
}
