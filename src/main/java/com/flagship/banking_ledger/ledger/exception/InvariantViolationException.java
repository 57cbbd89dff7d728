package com.flagship.banking_ledger.ledger.exception;

/**
 * Raised when a last-resort integrity check trips.
 *
 * Reaching this means a caller got past validation it should not have. It is
 * never retried and is always logged at error level.
 */
public class InvariantViolationException extends LedgerException {

    public InvariantViolationException(String message) {
        super(LedgerErrorCode.INVARIANT_VIOLATION, message);
    }
}
