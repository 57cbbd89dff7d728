package com.flagship.banking_ledger.ledger.exception;

public class AccountNotActiveException extends LedgerException {

    public AccountNotActiveException(long accountId, String status) {
        super(LedgerErrorCode.ACCOUNT_NOT_ACTIVE,
            String.format("Account %d is %s, operation requires ACTIVE", accountId, status));
    }
}
