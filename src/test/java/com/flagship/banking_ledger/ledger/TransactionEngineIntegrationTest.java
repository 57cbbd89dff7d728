package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.LedgerIntegrationTestSupport;
import com.flagship.banking_ledger.audit.AuditAction;
import com.flagship.banking_ledger.audit.AuditEntity;
import com.flagship.banking_ledger.audit.AuditLog;
import com.flagship.banking_ledger.audit.AuditRecord;
import com.flagship.banking_ledger.event.AggregateTypes;
import com.flagship.banking_ledger.event.InterestBatchPostedEvent;
import com.flagship.banking_ledger.event.TransactionPostedEvent;
import com.flagship.banking_ledger.ledger.exception.AccountNotActiveException;
import com.flagship.banking_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;
import com.flagship.banking_ledger.ledger.exception.LockContentionException;
import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import com.flagship.banking_ledger.ledger.exception.SelfTransferException;
import com.flagship.banking_ledger.outbox.OutboxEvent;
import com.flagship.banking_ledger.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end money movement against PostgreSQL: balances, ledger records, audit trail
 * and outbox events are checked together.
 */
@Testcontainers(disabledWithoutDocker = true)
class TransactionEngineIntegrationTest extends LedgerIntegrationTestSupport {

    @Autowired
    private TransactionEngine engine;

    @Autowired
    private TransactionLedger ledger;

    @Autowired
    private AuditLog auditLog;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private List<AuditRecord> auditOf(long accountId) {
        return auditLog.findByEntity(AuditEntity.ACCOUNT, accountId);
    }

    @Nested
    @DisplayName("Deposits and withdrawals")
    class DepositWithdraw {

        @Test
        @DisplayName("Deposit 1500.00 then withdraw 300.00 leaves 1200.00 and two records")
        void depositThenWithdraw() {
            printTestHeader("Deposit then withdraw");
            long accountId = openAccount(0L);

            engine.deposit(accountId, MoneyConverter.toMinorUnits(new BigDecimal("1500.00")), "Cash", ACTOR);
            engine.withdraw(accountId, MoneyConverter.toMinorUnits(new BigDecimal("300.00")), "ATM", ACTOR);

            List<LedgerTransaction> records = ledger.findByAccount(accountId);
            printOutput("Balance", MoneyConverter.toMajorUnits(balanceOf(accountId)));
            printOutput("Records", records.size());

            assertEquals(120_000L, balanceOf(accountId));
            assertEquals(2, records.size());
            assertEquals(TransactionType.DEPOSIT, records.get(0).getType());
            assertEquals(150_000L, records.get(0).getAmount());
            assertEquals(TransactionType.WITHDRAWAL, records.get(1).getType());
            assertEquals(30_000L, records.get(1).getAmount());
            assertEquals(ACTOR, records.get(1).getActor());
            printSuccess("Balance and ledger agree");
        }

        @Test
        @DisplayName("Withdrawing more than the balance fails and changes nothing")
        void insufficientFunds() {
            printTestHeader("Insufficient funds");
            long accountId = openAccount(120_000L);
            int auditBefore = auditOf(accountId).size();
            int recordsBefore = ledger.findByAccount(accountId).size();

            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> engine.withdraw(accountId, 120_001L, "ATM", ACTOR));
            printOutput("Error", e.getMessage());

            assertEquals(120_000L, balanceOf(accountId));
            assertEquals(recordsBefore, ledger.findByAccount(accountId).size());
            assertEquals(auditBefore, auditOf(accountId).size());
            printSuccess("Rejected withdrawal left no trace");
        }

        @Test
        @DisplayName("Rejected operations write no ledger, audit or outbox rows")
        void rejectedOperationsLeaveNoTrace() {
            long accountId = openAccount(10_000L);
            int records = ledger.findByAccount(accountId).size();
            int audit = auditOf(accountId).size();
            int events = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, String.valueOf(accountId)).size();

            assertThrows(InvalidAmountException.class, () -> engine.deposit(accountId, 0L, "zero", ACTOR));
            assertThrows(InvalidAmountException.class, () -> engine.withdraw(accountId, -5L, "negative", ACTOR));
            assertThrows(InvalidAmountException.class, () -> engine.postFee(accountId, 0L, "zero fee", ACTOR));
            assertThrows(SelfTransferException.class,
                () -> engine.transfer(accountId, accountId, 100L, "self", ACTOR));
            assertThrows(NotFoundException.class, () -> engine.deposit(Long.MAX_VALUE, 100L, "ghost", ACTOR));

            assertEquals(10_000L, balanceOf(accountId));
            assertEquals(records, ledger.findByAccount(accountId).size());
            assertEquals(audit, auditOf(accountId).size());
            assertEquals(events,
                outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, String.valueOf(accountId)).size());
        }

        @Test
        @DisplayName("Frozen accounts accept no deposits")
        void frozenAccountRejectsDeposit() {
            long accountId = openAccount(10_000L);
            accountService.freeze(accountId, ACTOR);

            assertThrows(AccountNotActiveException.class, () -> engine.deposit(accountId, 100L, "Cash", ACTOR));
            assertEquals(10_000L, balanceOf(accountId));
        }

        @Test
        @DisplayName("A deposit writes one audit record and one TransactionPosted event")
        void depositIsAuditedAndPublished() {
            long accountId = openAccount(0L);

            long txnId = engine.deposit(accountId, 2_500L, "Cash", "TELLER-7");

            List<AuditRecord> audit = auditOf(accountId);
            AuditRecord last = audit.get(audit.size() - 1);
            assertEquals(AuditAction.DEPOSIT, last.getAction());
            assertEquals("TELLER-7", last.getActor());
            assertTrue(last.getDetails().contains(String.valueOf(txnId)));

            List<OutboxEvent> events =
                outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, String.valueOf(accountId));
            OutboxEvent posted = events.get(events.size() - 1);
            assertEquals(TransactionPostedEvent.EVENT_TYPE, posted.getEventType());
            assertFalse(posted.isPublished());
        }
    }

    @Nested
    @DisplayName("Transfers")
    class Transfers {

        @Test
        @DisplayName("Transfer 2000.00 from B to A writes one mirrored pair and conserves money")
        void transferPair() {
            printTestHeader("Transfer B -> A");
            long accountA = openAccount(120_000L);
            long accountB = openAccount(1_000_000L);
            printInput("From", accountB);
            printInput("To", accountA);

            TransferReceipt receipt = engine.transfer(accountB, accountA, 200_000L, "Rent", ACTOR);

            assertEquals(800_000L, balanceOf(accountB));
            assertEquals(320_000L, balanceOf(accountA));

            LedgerTransaction out = ledger.findByAccount(accountB).stream()
                .filter(t -> t.getType() == TransactionType.TRANSFER_OUT).findFirst().orElseThrow();
            LedgerTransaction in = ledger.findByAccount(accountA).stream()
                .filter(t -> t.getType() == TransactionType.TRANSFER_IN).findFirst().orElseThrow();
            printOutput("OUT", out);
            printOutput("IN", in);

            assertEquals(receipt.getOutTransactionId(), out.getId());
            assertEquals(receipt.getInTransactionId(), in.getId());
            assertEquals(out.getAmount(), in.getAmount());
            assertEquals(accountA, out.getCounterpartyAccountId());
            assertEquals(accountB, in.getCounterpartyAccountId());

            List<AuditRecord> sourceAudit = auditOf(accountB);
            AuditRecord sourceLast = sourceAudit.get(sourceAudit.size() - 1);
            assertEquals(AuditAction.TRANSFER, sourceLast.getAction());
            assertTrue(sourceLast.getDetails().contains(String.valueOf(out.getId())));

            List<AuditRecord> destinationAudit = auditOf(accountA);
            AuditRecord destinationLast = destinationAudit.get(destinationAudit.size() - 1);
            printOutput("Destination audit", destinationLast);
            assertEquals(AuditAction.TRANSFER, destinationLast.getAction());
            assertEquals(ACTOR, destinationLast.getActor());
            assertTrue(destinationLast.getDetails().contains("in_txn_id"));
            assertTrue(destinationLast.getDetails().contains(String.valueOf(in.getId())));
            printSuccess("Mirrored pair written");
        }

        @Test
        @DisplayName("Source with a higher id than destination transfers the same way")
        void higherSourceId() {
            long low = openAccount(0L);
            long high = openAccount(50_000L);

            engine.transfer(high, low, 20_000L, null, ACTOR);

            assertEquals(30_000L, balanceOf(high));
            assertEquals(20_000L, balanceOf(low));
        }

        @Test
        @DisplayName("Transfer to a closed account is rejected without moving money")
        void closedDestination() {
            long source = openAccount(50_000L);
            long destination = openAccount(0L);
            accountService.close(destination, ACTOR);

            assertThrows(AccountNotActiveException.class,
                () -> engine.transfer(source, destination, 1_000L, null, ACTOR));
            assertEquals(50_000L, balanceOf(source));
            assertTrue(ledger.findByAccount(destination).isEmpty());
        }
    }

    @Nested
    @DisplayName("Fees")
    class Fees {

        @Test
        @DisplayName("Fee larger than the balance empties the account but records the nominal fee")
        void feeCappedAtBalance() {
            printTestHeader("Fee capped at balance");
            long accountId = openAccount(300L);

            long txnId = engine.postFee(accountId, 500L, "Maintenance", ACTOR);

            LedgerTransaction fee = ledger.findByAccount(accountId).stream()
                .filter(t -> t.getId() == txnId).findFirst().orElseThrow();
            printOutput("Balance", balanceOf(accountId));
            printOutput("Fee record", fee.getAmount());

            assertEquals(0L, balanceOf(accountId));
            assertEquals(500L, fee.getAmount());
            assertEquals(TransactionType.FEE, fee.getType());
            printSuccess("Balance never went negative");
        }

        @Test
        @DisplayName("Fee within the balance debits the full amount")
        void feeWithinBalance() {
            long accountId = openAccount(1_000L);

            engine.postFee(accountId, 250L, "Card fee", ACTOR);

            assertEquals(750L, balanceOf(accountId));
        }
    }

    @Nested
    @DisplayName("Interest batches")
    class Interest {

        @Test
        @DisplayName("3200.00 at 6% gets one INTEREST record of 16.00 and ends at 3216.00")
        void monthlyInterest() {
            printTestHeader("Interest batch");
            String type = newAccountType();
            long accountId = openAccount(type, 320_000L);

            InterestBatchResult result = engine.postInterestBatch(type, new BigDecimal("6.0"), ACTOR);

            List<LedgerTransaction> batch = ledger.findByBatch(result.getBatchId());
            printOutput("Result", result);

            assertEquals(321_600L, balanceOf(accountId));
            assertEquals(1, result.getPostings());
            assertEquals(1_600L, result.getTotalInterest());
            assertEquals(1, batch.size());
            assertEquals(TransactionType.INTEREST, batch.get(0).getType());
            assertEquals(1_600L, batch.get(0).getAmount());
            assertEquals("Monthly interest @6%", batch.get(0).getReference());

            List<AuditRecord> audit = auditOf(accountId);
            AuditRecord last = audit.get(audit.size() - 1);
            assertEquals(AuditAction.INTEREST, last.getAction());
            assertTrue(last.getDetails().contains(String.valueOf(batch.get(0).getId())));
            assertTrue(last.getDetails().contains(result.getBatchId().toString()));
            printSuccess("Interest posted");
        }

        @Test
        @DisplayName("Only ACTIVE accounts of the type with a positive balance are in the cohort")
        void cohortSelection() {
            String type = newAccountType();
            long earning = openAccount(type, 120_000L);
            long empty = openAccount(type, 0L);
            long frozen = openAccount(type, 120_000L);
            accountService.freeze(frozen, ACTOR);
            long otherType = openAccount(120_000L);

            InterestBatchResult result = engine.postInterestBatch(type, new BigDecimal("6"), ACTOR);

            assertEquals(1, result.getPostings());
            assertEquals(120_600L, balanceOf(earning));
            assertEquals(0L, balanceOf(empty));
            assertEquals(120_000L, balanceOf(frozen));
            assertEquals(120_000L, balanceOf(otherType));
        }

        @Test
        @DisplayName("A batch writes an audit record for the type and a summary event")
        void batchAuditAndEvent() {
            String type = newAccountType();
            openAccount(type, 240_000L);
            openAccount(type, 100L);

            InterestBatchResult result = engine.postInterestBatch(type, new BigDecimal("6"), "INTEREST_JOB");

            assertEquals(2, result.getPostings());
            assertEquals(1_201L, result.getTotalInterest());

            List<AuditRecord> audit = auditLog.findByEntity(AuditEntity.ACCOUNT_TYPE, type);
            assertEquals(1, audit.size());
            assertEquals(AuditAction.INTEREST_BATCH, audit.get(0).getAction());
            assertTrue(audit.get(0).getDetails().contains(result.getBatchId().toString()));

            List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT_TYPE, type);
            assertEquals(1, events.size());
            assertEquals(InterestBatchPostedEvent.EVENT_TYPE, events.get(0).getEventType());
        }

        @Test
        @DisplayName("A lock timeout on a later cohort account rolls back the records already appended")
        void lockTimeoutRollsBackWholeBatch() throws Exception {
            printTestHeader("Interest batch lock timeout");
            String type = newAccountType();
            long first = openAccount(type, 320_000L);
            long second = openAccount(type, 240_000L);
            int firstRecords = countRows("account_transactions", "account_id", first);
            int firstAudits = auditOf(first).size();

            TransactionTemplate tx = new TransactionTemplate(transactionManager);
            CountDownLatch locked = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService holder = Executors.newSingleThreadExecutor();
            try {
                // Hold the second account's row lock past the lock wait
                Future<?> holding = holder.submit(() -> tx.executeWithoutResult(status -> {
                    jdbcTemplate.queryForObject(
                        "SELECT balance_minor FROM accounts WHERE account_id = ? FOR UPDATE", Long.class, second);
                    locked.countDown();
                    try {
                        release.await(60, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }));
                assertTrue(locked.await(10, TimeUnit.SECONDS), "Row lock was not taken");

                assertThrows(LockContentionException.class,
                    () -> engine.postInterestBatch(type, new BigDecimal("6"), ACTOR));

                release.countDown();
                holding.get(10, TimeUnit.SECONDS);
            } finally {
                release.countDown();
                holder.shutdownNow();
            }

            printOutput("First balance", balanceOf(first));
            assertEquals(320_000L, balanceOf(first));
            assertEquals(240_000L, balanceOf(second));
            assertEquals(firstRecords, countRows("account_transactions", "account_id", first));
            assertEquals(firstAudits, auditOf(first).size());
            assertTrue(auditLog.findByEntity(AuditEntity.ACCOUNT_TYPE, type).isEmpty());
            assertTrue(outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT_TYPE, type).isEmpty());
            printSuccess("Nothing from the failed batch survived");
        }

        @Test
        @DisplayName("Unknown account type fails with NotFound")
        void unknownType() {
            assertThrows(NotFoundException.class,
                () -> engine.postInterestBatch("NO-SUCH-TYPE", new BigDecimal("6"), ACTOR));
        }
    }

    @Test
    @DisplayName("Transaction and audit rows cannot be updated or deleted")
    void appendOnlyTables() {
        long accountId = openAccount(5_000L);

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE account_transactions SET amount_minor = 1 WHERE account_id = ?", accountId));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM account_transactions WHERE account_id = ?", accountId));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM audit_log WHERE entity = ? AND entity_id = ?", "ACCOUNT", String.valueOf(accountId)));

        assertEquals(1, countRows("account_transactions", "account_id", accountId));
    }
}
