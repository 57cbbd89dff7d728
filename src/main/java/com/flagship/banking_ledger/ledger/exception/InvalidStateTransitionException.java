package com.flagship.banking_ledger.ledger.exception;

/**
 * Status change not allowed by the account or loan lifecycle.
 */
public class InvalidStateTransitionException extends LedgerException {

    public InvalidStateTransitionException(String message) {
        super(LedgerErrorCode.INVALID_STATE_TRANSITION, message);
    }
}
