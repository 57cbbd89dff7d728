package com.flagship.banking_ledger.ledger.exception;

public class InsufficientFundsException extends LedgerException {

    public InsufficientFundsException(long accountId, long balance, long requested) {
        super(LedgerErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds on account %d: balance=%d, requested=%d",
                accountId, balance, requested));
    }
}
