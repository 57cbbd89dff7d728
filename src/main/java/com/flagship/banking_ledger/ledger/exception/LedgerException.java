package com.flagship.banking_ledger.ledger.exception;

/**
 * Base type for every rejection raised by the ledger core.
 *
 * Unchecked so that {@code @Transactional} boundaries roll back on it without
 * extra configuration.
 */
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    protected LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public LedgerErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
