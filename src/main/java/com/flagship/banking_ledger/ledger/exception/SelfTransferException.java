package com.flagship.banking_ledger.ledger.exception;

public class SelfTransferException extends LedgerException {

    public SelfTransferException(long accountId) {
        super(LedgerErrorCode.SELF_TRANSFER, "Cannot transfer to same account: " + accountId);
    }
}
