package com.flagship.banking_ledger.ledger;

import lombok.Value;

/**
 * Balance and status read under an exclusive row lock. Valid only inside the
 * transaction that took the lock.
 */
@Value
public class LockedAccount {
    long id;
    String accountNumber;
    long balance;
    AccountStatus status;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
