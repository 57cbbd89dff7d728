package com.flagship.banking_ledger.ledger.exception;

/**
 * Error taxonomy of the ledger core.
 *
 * Every rejected operation maps to exactly one code. Only lock contention is
 * retryable; the core never retries on its own, the caller decides.
 */
public enum LedgerErrorCode {
    NOT_FOUND(false),
    ACCOUNT_NOT_ACTIVE(false),
    LOAN_NOT_ACTIVE(false),
    INVALID_AMOUNT(false),
    INSUFFICIENT_FUNDS(false),
    SELF_TRANSFER(false),
    INVALID_STATE_TRANSITION(false),

    /**
     * A last-resort integrity guard tripped. Indicates a validation bug, never a user error.
     */
    INVARIANT_VIOLATION(false),

    /**
     * A row lock could not be acquired within the configured lock timeout.
     */
    LOCK_CONTENTION(true);

    private final boolean retryable;

    LedgerErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
