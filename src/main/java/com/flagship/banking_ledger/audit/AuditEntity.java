package com.flagship.banking_ledger.audit;

/**
 * Kind of entity an audit record is about. An interest batch is recorded against the
 * account type of its cohort.
 */
public enum AuditEntity {
    ACCOUNT,
    LOAN,
    ACCOUNT_TYPE
}
