package com.flagship.banking_ledger.ledger.exception;

/**
 * Non-positive or malformed amount.
 */
public class InvalidAmountException extends LedgerException {

    public InvalidAmountException(String message) {
        super(LedgerErrorCode.INVALID_AMOUNT, message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(LedgerErrorCode.INVALID_AMOUNT, message, cause);
    }
}
