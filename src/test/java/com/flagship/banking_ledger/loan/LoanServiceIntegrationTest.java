package com.flagship.banking_ledger.loan;

import com.flagship.banking_ledger.LedgerIntegrationTestSupport;
import com.flagship.banking_ledger.audit.AuditAction;
import com.flagship.banking_ledger.audit.AuditEntity;
import com.flagship.banking_ledger.audit.AuditLog;
import com.flagship.banking_ledger.audit.AuditRecord;
import com.flagship.banking_ledger.event.AggregateTypes;
import com.flagship.banking_ledger.event.LoanLifecycleEvent;
import com.flagship.banking_ledger.ledger.LedgerTransaction;
import com.flagship.banking_ledger.ledger.TransactionType;
import com.flagship.banking_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.banking_ledger.ledger.exception.LoanNotActiveException;
import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import com.flagship.banking_ledger.outbox.OutboxEvent;
import com.flagship.banking_ledger.outbox.OutboxService;
import com.flagship.banking_ledger.reference.LoanProduct;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loan disbursement and repayment against PostgreSQL, including atomicity of the loan
 * change with the account movement.
 */
@Testcontainers(disabledWithoutDocker = true)
class LoanServiceIntegrationTest extends LedgerIntegrationTestSupport {

    @Autowired
    private LoanService loanService;

    @Autowired
    private AuditLog auditLog;

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("Disburse 50000.00 then pay 5000.00: account and loan move together")
    void disburseAndPay() {
        printTestHeader("Disburse and pay");
        String product = newLoanProduct();
        long accountId = openAccount(321_600L);
        printInput("Product", product);

        long loanId = loanService.createAndDisburse(1L, 1L, product, 5_000_000L, accountId, "LOAN_OFFICER");

        Loan loan = loanService.getLoan(loanId);
        assertEquals(5_321_600L, balanceOf(accountId));
        assertEquals(LoanStatus.ACTIVE, loan.getStatus());
        assertEquals(5_000_000L, loan.getOutstanding());
        assertEquals(5_000_000L, loan.getDisbursed());
        LoanProduct loanProduct = loanService.getProduct(loanId);
        assertEquals(product, loanProduct.getCode());
        assertEquals(1200, loanProduct.getAnnualRateBasisPoints());
        assertEquals(36, loanProduct.getTermMonths());

        LoanPayment payment = loanService.recordPayment(loanId, accountId, 500_000L, ACTOR);
        Loan afterPayment = loanService.getLoan(loanId);
        printOutput("Payment", payment);
        printOutput("Loan", afterPayment);

        assertEquals(4_821_600L, balanceOf(accountId));
        assertEquals(4_500_000L, afterPayment.getOutstanding());
        assertEquals(LoanStatus.ACTIVE, afterPayment.getStatus());

        List<LoanPayment> payments = loanService.getPayments(loanId);
        assertEquals(1, payments.size());
        assertEquals(500_000L, payments.get(0).getAmount());
        assertEquals(PaymentMethod.TRANSFER, payments.get(0).getMethod());
        assertEquals("From AC " + accountId, payments.get(0).getReference());

        List<LedgerTransaction> records = accountService.getTransactions(accountId);
        LedgerTransaction disbursement = records.get(records.size() - 2);
        LedgerTransaction repayment = records.get(records.size() - 1);
        assertEquals(TransactionType.DEPOSIT, disbursement.getType());
        assertEquals("Loan Disbursement L" + loanId, disbursement.getReference());
        assertEquals(TransactionType.WITHDRAWAL, repayment.getType());
        assertEquals("Loan Payment L" + loanId, repayment.getReference());
        printSuccess("Loan and account consistent");
    }

    @Test
    @DisplayName("Paying exactly the outstanding amount closes the loan")
    void exactPaymentCloses() {
        long accountId = openAccount(0L);
        long loanId = loanService.createAndDisburse(1L, 1L, newLoanProduct(), 100_000L, accountId, ACTOR);

        loanService.recordPayment(loanId, accountId, 100_000L, ACTOR);

        Loan loan = loanService.getLoan(loanId);
        assertEquals(LoanStatus.CLOSED, loan.getStatus());
        assertEquals(0L, loan.getOutstanding());
        assertNotNull(loan.getClosedAt());
        assertThrows(LoanNotActiveException.class, () -> loanService.recordPayment(loanId, accountId, 1L, ACTOR));
    }

    @Test
    @DisplayName("Over-payment withdraws the full amount but stops outstanding at zero")
    void overPayment() {
        printTestHeader("Over-payment");
        long accountId = openAccount(200_000L);
        long loanId = loanService.createAndDisburse(1L, 1L, newLoanProduct(), 100_000L, accountId, ACTOR);

        loanService.recordPayment(loanId, accountId, 150_000L, PaymentMethod.CARD, ACTOR);

        Loan loan = loanService.getLoan(loanId);
        printOutput("Balance", balanceOf(accountId));
        printOutput("Loan", loan);

        assertEquals(150_000L, balanceOf(accountId));
        assertEquals(0L, loan.getOutstanding());
        assertEquals(LoanStatus.CLOSED, loan.getStatus());
        assertEquals(PaymentMethod.CARD, loanService.getPayments(loanId).get(0).getMethod());
        printSuccess("Outstanding never negative");
    }

    @Test
    @DisplayName("A payment the funding account cannot cover leaves the loan untouched")
    void failedWithdrawalRollsBackPayment() {
        long borrower = openAccount(0L);
        long poor = openAccount(1_000L);
        long loanId = loanService.createAndDisburse(1L, 1L, newLoanProduct(), 500_000L, borrower, ACTOR);

        assertThrows(InsufficientFundsException.class,
            () -> loanService.recordPayment(loanId, poor, 5_000L, ACTOR));

        assertEquals(500_000L, loanService.getLoan(loanId).getOutstanding());
        assertTrue(loanService.getPayments(loanId).isEmpty());
        assertEquals(1_000L, balanceOf(poor));
        assertEquals(0, countRows("loan_payments", "loan_id", loanId));
    }

    @Test
    @DisplayName("Disbursement to an unknown product or account creates no loan")
    void failedDisbursement() {
        long accountId = openAccount(0L);

        assertThrows(NotFoundException.class,
            () -> loanService.createAndDisburse(1L, 1L, "NO-SUCH-PRODUCT", 1_000L, accountId, ACTOR));
        assertThrows(NotFoundException.class,
            () -> loanService.createAndDisburse(1L, 1L, newLoanProduct(), 1_000L, Long.MAX_VALUE, ACTOR));

        assertEquals(0L, balanceOf(accountId));
    }

    @Test
    @DisplayName("Default keeps the outstanding amount and blocks further payments")
    void markDefaulted() {
        long accountId = openAccount(10_000L);
        long loanId = loanService.createAndDisburse(1L, 1L, newLoanProduct(), 80_000L, accountId, ACTOR);
        loanService.recordPayment(loanId, accountId, 30_000L, ACTOR);

        Loan defaulted = loanService.markDefaulted(loanId, "RISK");

        assertEquals(LoanStatus.DEFAULTED, defaulted.getStatus());
        assertEquals(50_000L, defaulted.getOutstanding());
        assertThrows(LoanNotActiveException.class, () -> loanService.recordPayment(loanId, accountId, 1L, ACTOR));

        List<AuditRecord> audit = auditLog.findByEntity(AuditEntity.LOAN, loanId);
        assertEquals(List.of(AuditAction.DISBURSE, AuditAction.PAYMENT, AuditAction.DEFAULT),
            audit.stream().map(AuditRecord::getAction).toList());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateTypes.LOAN, String.valueOf(loanId));
        assertEquals(List.of(LoanLifecycleEvent.DISBURSED, LoanLifecycleEvent.PAYMENT_RECORDED,
                LoanLifecycleEvent.DEFAULTED),
            events.stream().map(OutboxEvent::getEventType).toList());
    }

    @Test
    @DisplayName("Unknown loan fails with NotFound")
    void unknownLoan() {
        assertThrows(NotFoundException.class, () -> loanService.getLoan(Long.MAX_VALUE));
        assertThrows(NotFoundException.class,
            () -> loanService.recordPayment(Long.MAX_VALUE, openAccount(1_000L), 100L, ACTOR));
    }
}
