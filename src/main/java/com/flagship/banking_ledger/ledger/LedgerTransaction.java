package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable transaction record.
 *
 * Amount is positive minor units. {@code counterpartyAccountId} is set for transfers only,
 * {@code batchId} for interest postings only.
 */
@Value
public class LedgerTransaction {
    long id;
    long accountId;
    Instant timestamp;
    TransactionType type;
    long amount;
    Long counterpartyAccountId;
    String reference;
    String actor;
    UUID batchId;
}
