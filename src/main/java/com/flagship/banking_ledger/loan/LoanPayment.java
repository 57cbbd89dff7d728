package com.flagship.banking_ledger.loan;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable record of one accepted loan payment. {@code id} is null until saved.
 */
@Value
public class LoanPayment {
    Long id;
    long loanId;
    Instant timestamp;
    long amount;
    PaymentMethod method;
    String reference;

    public static LoanPayment create(long loanId, Instant timestamp, long amount,
                                     PaymentMethod method, String reference) {
        return new LoanPayment(null, loanId, timestamp, amount, method, reference);
    }
}
