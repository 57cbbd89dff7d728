package com.flagship.banking_ledger.reference;

import lombok.Value;

/**
 * Loan product as published by the product catalogue. The rate is informational; the
 * ledger does not accrue loan interest.
 */
@Value
public class LoanProduct {
    long id;
    String code;
    String name;
    int annualRateBasisPoints;
    int termMonths;
}
