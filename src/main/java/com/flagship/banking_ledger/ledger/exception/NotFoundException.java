package com.flagship.banking_ledger.ledger.exception;

/**
 * Unknown account, loan, account type code or loan product code.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String entity, Object id) {
        super(LedgerErrorCode.NOT_FOUND, entity + " not found: " + id);
    }
}
