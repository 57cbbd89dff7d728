package com.flagship.banking_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events the ledger writes to its outbox.
 *
 * Events are facts: they are written in the same transaction as the change they describe
 * and never for a rejected operation.
 */
public interface LedgerEvent {

    /**
     * Unique identifier of this event instance, for consumer deduplication.
     */
    UUID getEventId();

    /**
     * "Account", "Loan" or "AccountType". Selects the topic.
     */
    String getAggregateType();

    /**
     * Id of the aggregate, used as the Kafka key.
     */
    String getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
