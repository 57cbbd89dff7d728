package com.flagship.banking_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for loans.
 *
 * No setters: identity, parties, product and principal are fixed at creation; the
 * disbursed and outstanding amounts, status and closing time change only through
 * {@link #updateFromDomain(Loan)}.
 */
@Entity
@Table(name = "loans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @Column(name = "loan_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private long customerId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private long branchId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private long productId;

    @Column(name = "principal_minor", nullable = false, updatable = false)
    private long principal;

    @Column(name = "disbursed_minor", nullable = false)
    private long disbursed;

    @Column(name = "outstanding_minor", nullable = false)
    private long outstanding;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LoanStatus status;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            loan.getId(),
            loan.getCustomerId(),
            loan.getBranchId(),
            loan.getProductId(),
            loan.getPrincipal(),
            loan.getDisbursed(),
            loan.getOutstanding(),
            loan.getStatus(),
            loan.getOpenedAt(),
            loan.getClosedAt()
        );
    }

    public Loan toDomain() {
        return new Loan(
            id,
            customerId,
            branchId,
            productId,
            principal,
            disbursed,
            outstanding,
            status,
            openedAt,
            closedAt
        );
    }

    void updateFromDomain(Loan loan) {
        this.disbursed = loan.getDisbursed();
        this.outstanding = loan.getOutstanding();
        this.status = loan.getStatus();
        this.closedAt = loan.getClosedAt();
    }
}
