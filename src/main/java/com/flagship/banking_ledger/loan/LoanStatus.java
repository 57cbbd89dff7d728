package com.flagship.banking_ledger.loan;

public enum LoanStatus {
    PENDING,
    ACTIVE,
    CLOSED,
    DEFAULTED
}
