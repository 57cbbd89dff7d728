package com.flagship.banking_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Loan payments are append-only: Hibernate never issues an UPDATE for this entity and the
 * table's trigger rejects one anyway.
 */
@Entity
@Immutable
@Table(name = "loan_payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanPaymentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private long loanId;

    @Column(name = "payment_time", nullable = false, updatable = false)
    private Instant paymentTime;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private PaymentMethod method;

    @Column(updatable = false, length = 120)
    private String reference;

    static LoanPaymentEntity fromDomain(LoanPayment payment) {
        return new LoanPaymentEntity(
            null,  // assigned by the database
            payment.getLoanId(),
            payment.getTimestamp(),
            payment.getAmount(),
            payment.getMethod(),
            payment.getReference()
        );
    }

    public LoanPayment toDomain() {
        return new LoanPayment(id, loanId, paymentTime, amount, method, reference);
    }
}
