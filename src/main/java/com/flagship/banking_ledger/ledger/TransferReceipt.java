package com.flagship.banking_ledger.ledger;

import lombok.Value;

/**
 * Ids of the two records a transfer appends.
 */
@Value
public class TransferReceipt {
    long outTransactionId;
    long inTransactionId;
}
