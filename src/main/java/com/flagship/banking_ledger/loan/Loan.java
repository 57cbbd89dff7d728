package com.flagship.banking_ledger.loan;

import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;
import com.flagship.banking_ledger.ledger.exception.InvalidStateTransitionException;
import com.flagship.banking_ledger.ledger.exception.LoanNotActiveException;
import lombok.Value;

import java.time.Instant;

/**
 * Loan domain object with an explicit state machine.
 *
 * PENDING -> ACTIVE on disbursement, ACTIVE -> CLOSED when a payment brings the outstanding
 * amount to zero, ACTIVE -> DEFAULTED by administrative decision. CLOSED and DEFAULTED are
 * terminal. State changes return a new instance.
 *
 * Invariant: 0 <= outstanding <= principal.
 */
@Value
public class Loan {
    long id;
    long customerId;
    long branchId;
    long productId;
    long principal;
    long disbursed;
    long outstanding;
    LoanStatus status;
    Instant openedAt;
    Instant closedAt;

    /**
     * A new loan before any money has moved.
     */
    public static Loan create(long id, long customerId, long branchId, long productId,
                              long principal, Instant openedAt) {
        if (principal <= 0) {
            throw new InvalidAmountException("Loan principal must be positive: " + principal);
        }
        return new Loan(
            id,
            customerId,
            branchId,
            productId,
            principal,
            0L,
            principal,
            LoanStatus.PENDING,
            openedAt,
            null
        );
    }

    /**
     * Marks the full principal as disbursed. Only valid from PENDING.
     */
    public Loan disburse() {
        requireTransition(LoanStatus.ACTIVE);
        return new Loan(id, customerId, branchId, productId, principal,
            principal, outstanding, LoanStatus.ACTIVE, openedAt, closedAt);
    }

    /**
     * Reduces the outstanding amount by {@code min(outstanding, amount)}. Reaching zero
     * closes the loan.
     *
     * @throws LoanNotActiveException unless the loan is ACTIVE
     */
    public Loan applyPayment(long amount, Instant at) {
        if (status != LoanStatus.ACTIVE) {
            throw new LoanNotActiveException(id, status.name());
        }
        if (amount <= 0) {
            throw new InvalidAmountException("Payment amount must be positive: " + amount);
        }
        long remaining = outstanding - Math.min(outstanding, amount);
        if (remaining == 0) {
            return new Loan(id, customerId, branchId, productId, principal,
                disbursed, 0L, LoanStatus.CLOSED, openedAt, at);
        }
        return new Loan(id, customerId, branchId, productId, principal,
            disbursed, remaining, LoanStatus.ACTIVE, openedAt, closedAt);
    }

    /**
     * Only valid from ACTIVE.
     */
    public Loan markDefaulted() {
        requireTransition(LoanStatus.DEFAULTED);
        return new Loan(id, customerId, branchId, productId, principal,
            disbursed, outstanding, LoanStatus.DEFAULTED, openedAt, closedAt);
    }

    public boolean isTerminal() {
        return status == LoanStatus.CLOSED || status == LoanStatus.DEFAULTED;
    }

    public boolean canTransitionTo(LoanStatus target) {
        return switch (status) {
            case PENDING -> target == LoanStatus.ACTIVE;
            case ACTIVE -> target == LoanStatus.CLOSED || target == LoanStatus.DEFAULTED;
            case CLOSED, DEFAULTED -> false;
        };
    }

    private void requireTransition(LoanStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateTransitionException(String.format(
                "Loan %d cannot move from %s to %s", id, status, target));
        }
    }
}
