package com.flagship.banking_ledger.ledger.exception;

public class LoanNotActiveException extends LedgerException {

    public LoanNotActiveException(long loanId, String status) {
        super(LedgerErrorCode.LOAN_NOT_ACTIVE,
            String.format("Loan %d is %s, operation requires ACTIVE", loanId, status));
    }
}
