package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Read model of an account row. Balance is in minor units and never negative.
 * There is no way to build a modified copy; balances change only through the engine.
 */
@Value
public class Account {
    long id;
    String accountNumber;
    long customerId;
    long branchId;
    long accountTypeId;
    long balance;
    AccountStatus status;
    Instant openedAt;
    Instant closedAt;
}
