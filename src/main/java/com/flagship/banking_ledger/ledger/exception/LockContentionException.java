package com.flagship.banking_ledger.ledger.exception;

/**
 * A row lock was not granted within the lock timeout, or the database picked
 * this transaction as a deadlock victim. Nothing was applied; safe to retry.
 */
public class LockContentionException extends LedgerException {

    public LockContentionException(String message, Throwable cause) {
        super(LedgerErrorCode.LOCK_CONTENTION, message, cause);
    }
}
