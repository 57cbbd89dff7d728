package com.flagship.banking_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class InterestBatchResult {
    UUID batchId;
    String accountTypeCode;
    BigDecimal annualRatePercent;
    int postings;
    long totalInterest;
}
