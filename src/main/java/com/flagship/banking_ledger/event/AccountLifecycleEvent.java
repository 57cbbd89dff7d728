package com.flagship.banking_ledger.event;

import com.flagship.banking_ledger.ledger.Account;
import com.flagship.banking_ledger.ledger.AccountStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an account is opened or changes status.
 */
@Value
public class AccountLifecycleEvent implements LedgerEvent {
    UUID eventId;
    String eventType;
    long accountId;
    String accountNumber;
    String previousStatus;
    String status;
    String actor;
    Instant occurredAt;

    public static final String OPENED = "AccountOpened";
    public static final String STATUS_CHANGED = "AccountStatusChanged";

    @Override
    public String getAggregateType() {
        return AggregateTypes.ACCOUNT;
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(accountId);
    }

    public static AccountLifecycleEvent opened(Account account, String actor) {
        return new AccountLifecycleEvent(
            UUID.randomUUID(),
            OPENED,
            account.getId(),
            account.getAccountNumber(),
            null,
            account.getStatus().name(),
            actor,
            account.getOpenedAt()
        );
    }

    public static AccountLifecycleEvent statusChanged(long accountId, String accountNumber,
                                                      AccountStatus from, AccountStatus to,
                                                      String actor, Instant occurredAt) {
        return new AccountLifecycleEvent(
            UUID.randomUUID(),
            STATUS_CHANGED,
            accountId,
            accountNumber,
            from.name(),
            to.name(),
            actor,
            occurredAt
        );
    }
}
