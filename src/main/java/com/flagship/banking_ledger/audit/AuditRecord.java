package com.flagship.banking_ledger.audit;

import lombok.Value;

import java.time.Instant;

/**
 * One audit log row. {@code details} is the JSON document as stored.
 */
@Value
public class AuditRecord {
    long id;
    Instant timestamp;
    String actor;
    AuditAction action;
    AuditEntity entity;
    String entityId;
    String details;
}
