package com.flagship.banking_ledger.audit;

public enum AuditAction {
    CREATE,
    DEPOSIT,
    WITHDRAWAL,
    TRANSFER,
    FEE,
    INTEREST,
    INTEREST_BATCH,
    STATUS_CHANGE,
    DISBURSE,
    PAYMENT,
    DEFAULT
}
