package com.flagship.banking_ledger.ledger;

/**
 * Account lifecycle: ACTIVE and FROZEN switch back and forth, CLOSED is terminal and
 * reachable only from ACTIVE.
 */
public enum AccountStatus {
    ACTIVE,
    FROZEN,
    CLOSED;

    public boolean canTransitionTo(AccountStatus target) {
        return switch (this) {
            case ACTIVE -> target == FROZEN || target == CLOSED;
            case FROZEN -> target == ACTIVE;
            case CLOSED -> false;
        };
    }
}
