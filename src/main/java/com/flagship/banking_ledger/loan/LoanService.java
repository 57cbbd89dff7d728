package com.flagship.banking_ledger.loan;

import com.flagship.banking_ledger.audit.AuditAction;
import com.flagship.banking_ledger.audit.AuditEntity;
import com.flagship.banking_ledger.audit.AuditLog;
import com.flagship.banking_ledger.event.LoanLifecycleEvent;
import com.flagship.banking_ledger.ledger.LockWaitPolicy;
import com.flagship.banking_ledger.ledger.TransactionEngine;
import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;
import com.flagship.banking_ledger.ledger.exception.LedgerException;
import com.flagship.banking_ledger.ledger.exception.LoanNotActiveException;
import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import com.flagship.banking_ledger.observability.CorrelationContext;
import com.flagship.banking_ledger.observability.LedgerMetrics;
import com.flagship.banking_ledger.outbox.OutboxService;
import com.flagship.banking_ledger.reference.IdentifierGenerator;
import com.flagship.banking_ledger.reference.LoanProduct;
import com.flagship.banking_ledger.reference.ReferenceDataLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Loan lifecycle on top of the transaction engine.
 *
 * Loans never touch balances directly: disbursement is an engine deposit and every
 * payment an engine withdrawal, made in the same transaction as the loan change. If the
 * money movement is rejected, the loan is left exactly as it was.
 *
 * Lock order is loan row first, then the account row the engine locks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final LoanPersistenceService persistenceService;
    private final TransactionEngine engine;
    private final ReferenceDataLookup referenceData;
    private final IdentifierGenerator identifiers;
    private final AuditLog auditLog;
    private final OutboxService outboxService;
    private final LockWaitPolicy lockWaitPolicy;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Creates a loan and deposits the principal into the target account.
     *
     * 1. Validates the principal and resolves the product
     * 2. Saves the loan PENDING with outstanding = principal
     * 3. Deposits the principal via the engine (reference "Loan Disbursement L&lt;id&gt;")
     * 4. Marks the loan ACTIVE and disbursed, then writes its own audit record and event
     *
     * @return the new loan's id
     */
    @Transactional
    public long createAndDisburse(long customerId, long branchId, String productCode,
                                  long principal, long targetAccountId, String actor) {
        long startTime = System.currentTimeMillis();
        try {
            if (principal <= 0) {
                throw new InvalidAmountException("Loan principal must be positive: " + principal);
            }
            String who = engine.resolveActor(actor);
            long productId = referenceData.resolveProductId(productCode);
            lockWaitPolicy.apply();

            long loanId = identifiers.nextLoanId();
            try (CorrelationContext.MdcScope ignored =
                     CorrelationContext.putScoped(CorrelationContext.LOAN_ID_MDC_KEY, loanId)) {
                Instant now = now();
                Loan pending = persistenceService.save(
                    Loan.create(loanId, customerId, branchId, productId, principal, now));

                engine.deposit(targetAccountId, principal, "Loan Disbursement L" + loanId, who);

                Loan active = persistenceService.update(pending.disburse());

                auditLog.append(who, AuditAction.DISBURSE, AuditEntity.LOAN, loanId,
                    AuditLog.details(
                        "principal_minor", principal,
                        "to_account", targetAccountId,
                        "product", productCode));
                outboxService.saveEvent(LoanLifecycleEvent.disbursed(active, targetAccountId, who, now));

                metrics.recordOperation("loan_disburse", LedgerMetrics.OUTCOME_SUCCESS, elapsedSince(startTime));
                log.info("Loan disbursed: principal={}, toAccount={}, product={}",
                    principal, targetAccountId, productCode);
                return loanId;
            }
        } catch (LedgerException e) {
            metrics.recordOperation("loan_disburse", e.getErrorCode().name(), elapsedSince(startTime));
            log.warn("Loan disbursement rejected: code={}, reason={}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    @Transactional
    public LoanPayment recordPayment(long loanId, long fundingAccountId, long amount, String actor) {
        return recordPayment(loanId, fundingAccountId, amount, PaymentMethod.TRANSFER, actor);
    }

    /**
     * Collects a payment: withdraws from the funding account first, and only then records
     * the payment and reduces the outstanding amount by {@code min(outstanding, amount)}.
     * A payment that clears the loan closes it. An over-payment is withdrawn in full.
     */
    @Transactional
    public LoanPayment recordPayment(long loanId, long fundingAccountId, long amount,
                                     PaymentMethod method, String actor) {
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.MdcScope ignored =
                 CorrelationContext.putScoped(CorrelationContext.LOAN_ID_MDC_KEY, loanId)) {
            try {
                String who = engine.resolveActor(actor);
                lockWaitPolicy.apply();

                Loan loan = persistenceService.findByIdForUpdate(loanId)
                    .orElseThrow(() -> new NotFoundException("Loan", loanId));
                if (loan.getStatus() != LoanStatus.ACTIVE) {
                    throw new LoanNotActiveException(loanId, loan.getStatus().name());
                }
                if (amount <= 0) {
                    throw new InvalidAmountException("Payment amount must be positive: " + amount);
                }

                engine.withdraw(fundingAccountId, amount, "Loan Payment L" + loanId, who);

                Instant now = now();
                LoanPayment payment = persistenceService.savePayment(LoanPayment.create(
                    loanId, now, amount, method != null ? method : PaymentMethod.TRANSFER,
                    "From AC " + fundingAccountId));
                Loan updated = persistenceService.update(loan.applyPayment(amount, now));

                auditLog.append(who, AuditAction.PAYMENT, AuditEntity.LOAN, loanId,
                    AuditLog.details(
                        "amount_minor", amount,
                        "from_account", fundingAccountId,
                        "payment_id", payment.getId(),
                        "outstanding_minor", updated.getOutstanding()));
                outboxService.saveEvent(LoanLifecycleEvent.paymentRecorded(updated, fundingAccountId, amount, who, now));

                metrics.recordOperation("loan_payment", LedgerMetrics.OUTCOME_SUCCESS, elapsedSince(startTime));
                if (updated.getStatus() == LoanStatus.CLOSED) {
                    log.info("Loan paid off and closed: payment={}, overpayment={}",
                        amount, Math.max(0, amount - loan.getOutstanding()));
                } else {
                    log.info("Loan payment recorded: amount={}, outstanding={}", amount, updated.getOutstanding());
                }
                return payment;

            } catch (LedgerException e) {
                metrics.recordOperation("loan_payment", e.getErrorCode().name(), elapsedSince(startTime));
                log.warn("Loan payment rejected: code={}, reason={}", e.getErrorCode(), e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Administrative write-off of an ACTIVE loan. No money moves.
     */
    @Transactional
    public Loan markDefaulted(long loanId, String actor) {
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.MdcScope ignored =
                 CorrelationContext.putScoped(CorrelationContext.LOAN_ID_MDC_KEY, loanId)) {
            try {
                String who = engine.resolveActor(actor);
                lockWaitPolicy.apply();

                Loan loan = persistenceService.findByIdForUpdate(loanId)
                    .orElseThrow(() -> new NotFoundException("Loan", loanId));
                Loan defaulted = persistenceService.update(loan.markDefaulted());

                auditLog.append(who, AuditAction.DEFAULT, AuditEntity.LOAN, loanId,
                    AuditLog.details("outstanding_minor", defaulted.getOutstanding()));
                outboxService.saveEvent(LoanLifecycleEvent.defaulted(defaulted, who, now()));

                metrics.recordOperation("loan_default", LedgerMetrics.OUTCOME_SUCCESS, elapsedSince(startTime));
                log.info("Loan marked defaulted: outstanding={}", defaulted.getOutstanding());
                return defaulted;

            } catch (LedgerException e) {
                metrics.recordOperation("loan_default", e.getErrorCode().name(), elapsedSince(startTime));
                log.warn("Loan default rejected: code={}, reason={}", e.getErrorCode(), e.getMessage());
                throw e;
            }
        }
    }

    @Transactional(readOnly = true)
    public Loan getLoan(long loanId) {
        return persistenceService.findById(loanId)
            .orElseThrow(() -> new NotFoundException("Loan", loanId));
    }

    @Transactional(readOnly = true)
    public LoanProduct getProduct(long loanId) {
        Loan loan = getLoan(loanId);
        return referenceData.findProduct(loan.getProductId())
            .orElseThrow(() -> new NotFoundException("Loan product", loan.getProductId()));
    }

    @Transactional(readOnly = true)
    public List<LoanPayment> getPayments(long loanId) {
        getLoan(loanId);
        return persistenceService.findPayments(loanId);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
