package com.flagship.banking_ledger.event;

import com.flagship.banking_ledger.loan.Loan;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a loan is disbursed, receives a payment, or is marked defaulted.
 *
 * {@code accountId} and {@code amount} describe the money movement and are null for
 * a default.
 */
@Value
public class LoanLifecycleEvent implements LedgerEvent {
    UUID eventId;
    String eventType;
    long loanId;
    Long accountId;
    Long amount;
    long principal;
    long outstanding;
    String status;
    String actor;
    Instant occurredAt;

    public static final String DISBURSED = "LoanDisbursed";
    public static final String PAYMENT_RECORDED = "LoanPaymentRecorded";
    public static final String DEFAULTED = "LoanDefaulted";

    @Override
    public String getAggregateType() {
        return AggregateTypes.LOAN;
    }

    @Override
    public String getAggregateId() {
        return String.valueOf(loanId);
    }

    public static LoanLifecycleEvent disbursed(Loan loan, long targetAccountId, String actor, Instant at) {
        return of(DISBURSED, loan, targetAccountId, loan.getDisbursed(), actor, at);
    }

    public static LoanLifecycleEvent paymentRecorded(Loan loan, long fundingAccountId, long amount,
                                                     String actor, Instant at) {
        return of(PAYMENT_RECORDED, loan, fundingAccountId, amount, actor, at);
    }

    public static LoanLifecycleEvent defaulted(Loan loan, String actor, Instant at) {
        return of(DEFAULTED, loan, null, null, actor, at);
    }

    private static LoanLifecycleEvent of(String type, Loan loan, Long accountId, Long amount,
                                         String actor, Instant at) {
        return new LoanLifecycleEvent(
            UUID.randomUUID(),
            type,
            loan.getId(),
            accountId,
            amount,
            loan.getPrincipal(),
            loan.getOutstanding(),
            loan.getStatus().name(),
            actor,
            at
        );
    }
}
