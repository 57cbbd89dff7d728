package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.audit.AuditAction;
import com.flagship.banking_ledger.audit.AuditEntity;
import com.flagship.banking_ledger.audit.AuditLog;
import com.flagship.banking_ledger.event.InterestBatchPostedEvent;
import com.flagship.banking_ledger.event.TransactionPostedEvent;
import com.flagship.banking_ledger.ledger.exception.AccountNotActiveException;
import com.flagship.banking_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;
import com.flagship.banking_ledger.ledger.exception.InvariantViolationException;
import com.flagship.banking_ledger.ledger.exception.LedgerException;
import com.flagship.banking_ledger.ledger.exception.LockContentionException;
import com.flagship.banking_ledger.ledger.exception.SelfTransferException;
import com.flagship.banking_ledger.observability.CorrelationContext;
import com.flagship.banking_ledger.observability.LedgerMetrics;
import com.flagship.banking_ledger.outbox.OutboxService;
import com.flagship.banking_ledger.reference.ReferenceDataLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Money movement on accounts.
 *
 * Every public method is one atomic unit: lock the account rows, validate, change the
 * balance(s), append the transaction record(s), append one audit record and write the
 * outbox event(s), then commit. A rejected operation throws before anything is written,
 * and anything already written in the unit rolls back with it.
 *
 * Lock protocol:
 * - Rows are locked with SELECT ... FOR UPDATE and held until commit or rollback
 * - Two-account operations lock in ascending account id, whichever way the money flows,
 *   so two opposite transfers can never wait on each other
 * - Waits are bounded by {@link LockWaitPolicy}; running out is a retryable
 *   {@link LockContentionException}, never retried here
 *
 * Callers that compose operations (account opening, loans) call these methods from their
 * own transaction; the engine joins it rather than committing on its own.
 */
@Service
@Slf4j
public class TransactionEngine {

    private final AccountStore accountStore;
    private final TransactionLedger ledger;
    private final AuditLog auditLog;
    private final OutboxService outboxService;
    private final ReferenceDataLookup referenceData;
    private final LockWaitPolicy lockWaitPolicy;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final String defaultActor;

    public TransactionEngine(AccountStore accountStore,
                             TransactionLedger ledger,
                             AuditLog auditLog,
                             OutboxService outboxService,
                             ReferenceDataLookup referenceData,
                             LockWaitPolicy lockWaitPolicy,
                             LedgerMetrics metrics,
                             Clock clock,
                             @Value("${ledger.default-actor:SYSTEM}") String defaultActor) {
        this.accountStore = accountStore;
        this.ledger = ledger;
        this.auditLog = auditLog;
        this.outboxService = outboxService;
        this.referenceData = referenceData;
        this.lockWaitPolicy = lockWaitPolicy;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultActor = defaultActor;
    }

    /**
     * Credits an ACTIVE account.
     *
     * @return id of the DEPOSIT record
     */
    @Transactional
    public long deposit(long accountId, long amount, String reference, String actor) {
        return execute("deposit", accountId, () -> {
            requirePositive(amount);
            String who = resolveActor(actor);
            lockWaitPolicy.apply();

            LockedAccount account = accountStore.getForUpdate(accountId);
            requireActive(account);

            accountStore.applyDelta(accountId, amount);
            LedgerTransaction txn = ledger.append(accountId, TransactionType.DEPOSIT, amount,
                null, reference, who);

            auditLog.append(who, AuditAction.DEPOSIT, AuditEntity.ACCOUNT, accountId,
                AuditLog.details("txn_id", txn.getId(), "amount_minor", amount, "reference", reference));
            outboxService.saveEvent(TransactionPostedEvent.fromTransaction(txn));

            log.info("Deposit posted: txnId={}, amount={}, balanceBefore={}",
                txn.getId(), amount, account.getBalance());
            return txn.getId();
        });
    }

    /**
     * Debits an ACTIVE account that holds at least {@code amount}.
     *
     * @return id of the WITHDRAWAL record
     */
    @Transactional
    public long withdraw(long accountId, long amount, String reference, String actor) {
        return execute("withdraw", accountId, () -> {
            requirePositive(amount);
            String who = resolveActor(actor);
            lockWaitPolicy.apply();

            LockedAccount account = accountStore.getForUpdate(accountId);
            requireActive(account);
            requireFunds(account, amount);

            accountStore.applyDelta(accountId, -amount);
            LedgerTransaction txn = ledger.append(accountId, TransactionType.WITHDRAWAL, amount,
                null, reference, who);

            auditLog.append(who, AuditAction.WITHDRAWAL, AuditEntity.ACCOUNT, accountId,
                AuditLog.details("txn_id", txn.getId(), "amount_minor", amount, "reference", reference));
            outboxService.saveEvent(TransactionPostedEvent.fromTransaction(txn));

            log.info("Withdrawal posted: txnId={}, amount={}, balanceBefore={}",
                txn.getId(), amount, account.getBalance());
            return txn.getId();
        });
    }

    /**
     * Moves {@code amount} between two ACTIVE accounts. Appends a TRANSFER_OUT on the source
     * naming the destination and a TRANSFER_IN on the destination naming the source.
     * Both accounts get an audit record.
     */
    @Transactional
    public TransferReceipt transfer(long fromAccountId, long toAccountId, long amount,
                                    String reference, String actor) {
        return execute("transfer", fromAccountId, () -> {
            if (fromAccountId == toAccountId) {
                throw new SelfTransferException(fromAccountId);
            }
            requirePositive(amount);
            String who = resolveActor(actor);
            lockWaitPolicy.apply();

            LockedAccount first = accountStore.getForUpdate(Math.min(fromAccountId, toAccountId));
            LockedAccount second = accountStore.getForUpdate(Math.max(fromAccountId, toAccountId));
            LockedAccount source = first.getId() == fromAccountId ? first : second;
            LockedAccount destination = source == first ? second : first;

            requireActive(source);
            requireActive(destination);
            requireFunds(source, amount);

            accountStore.applyDelta(fromAccountId, -amount);
            accountStore.applyDelta(toAccountId, amount);

            LedgerTransaction out = ledger.append(fromAccountId, TransactionType.TRANSFER_OUT, amount,
                toAccountId, reference, who);
            LedgerTransaction in = ledger.append(toAccountId, TransactionType.TRANSFER_IN, amount,
                fromAccountId, reference, who);

            auditLog.append(who, AuditAction.TRANSFER, AuditEntity.ACCOUNT, fromAccountId,
                AuditLog.details(
                    "to_account", toAccountId,
                    "amount_minor", amount,
                    "out_txn_id", out.getId(),
                    "in_txn_id", in.getId(),
                    "reference", reference));
            auditLog.append(who, AuditAction.TRANSFER, AuditEntity.ACCOUNT, toAccountId,
                AuditLog.details(
                    "from_account", fromAccountId,
                    "amount_minor", amount,
                    "in_txn_id", in.getId(),
                    "reference", reference));
            outboxService.saveEvent(TransactionPostedEvent.fromTransaction(out));
            outboxService.saveEvent(TransactionPostedEvent.fromTransaction(in));

            log.info("Transfer posted: to={}, amount={}, outTxnId={}, inTxnId={}",
                toAccountId, amount, out.getId(), in.getId());
            return new TransferReceipt(out.getId(), in.getId());
        });
    }

    /**
     * Charges a fee. The debit is capped at the available balance, so a fee never drives
     * the account negative, but the FEE record carries the nominal amount.
     *
     * @return id of the FEE record
     */
    @Transactional
    public long postFee(long accountId, long amount, String reference, String actor) {
        return execute("fee", accountId, () -> {
            requirePositive(amount);
            String who = resolveActor(actor);
            lockWaitPolicy.apply();

            LockedAccount account = accountStore.getForUpdate(accountId);
            requireActive(account);

            long debit = Math.min(account.getBalance(), amount);
            if (debit > 0) {
                accountStore.applyDelta(accountId, -debit);
            }
            LedgerTransaction txn = ledger.append(accountId, TransactionType.FEE, amount,
                null, reference, who);

            auditLog.append(who, AuditAction.FEE, AuditEntity.ACCOUNT, accountId,
                AuditLog.details(
                    "txn_id", txn.getId(),
                    "amount_minor", amount,
                    "debited_minor", debit,
                    "reference", reference));
            outboxService.saveEvent(TransactionPostedEvent.fromTransaction(txn));

            if (debit < amount) {
                metrics.recordFeeCapped();
                log.warn("Fee capped at available balance: txnId={}, nominal={}, debited={}",
                    txn.getId(), amount, debit);
            } else {
                log.info("Fee posted: txnId={}, amount={}", txn.getId(), amount);
            }
            return txn.getId();
        });
    }

    /**
     * Posts one month of interest to every ACTIVE account of the type with a positive balance.
     *
     * Phase 1: lock the cohort one account at a time in ascending id order, compute each
     * account's interest from its locked balance and append the INTEREST records under a
     * fresh batch id. Accounts whose interest rounds to zero get no record.
     *
     * Phase 2: credit each account with the sum of its INTEREST records in this batch.
     *
     * Every posting is audited against its account and the batch against the account type.
     * The whole batch is one transaction. A zero rate yields an empty batch.
     */
    @Transactional
    public InterestBatchResult postInterestBatch(String accountTypeCode, BigDecimal annualRatePercent,
                                                 String actor) {
        return execute("interest_batch", null, () -> {
            if (annualRatePercent == null || annualRatePercent.signum() < 0) {
                throw new InvalidAmountException("Annual rate must be zero or positive: " + annualRatePercent);
            }
            String who = resolveActor(actor);
            long accountTypeId = referenceData.resolveAccountTypeId(accountTypeCode);
            lockWaitPolicy.apply();

            UUID batchId = UUID.randomUUID();
            String reference = "Monthly interest @" + annualRatePercent.stripTrailingZeros().toPlainString() + "%";

            // Phase 1: compute from the locked snapshot and record
            List<LedgerTransaction> postings = new ArrayList<>();
            for (long accountId : accountStore.findCohortIds(accountTypeId)) {
                LockedAccount account = accountStore.getForUpdate(accountId);
                if (!account.isActive() || account.getBalance() <= 0) {
                    continue;
                }
                long interest = InterestCalculator.monthlyInterest(account.getBalance(), annualRatePercent);
                if (interest == 0) {
                    continue;
                }
                postings.add(ledger.append(accountId, TransactionType.INTEREST, interest,
                    null, reference, who, batchId));
            }

            // Phase 2: apply
            long total = 0;
            for (LedgerTransaction posting : postings) {
                long credit = ledger.sumAmounts(posting.getAccountId(), TransactionType.INTEREST, batchId);
                accountStore.applyDelta(posting.getAccountId(), credit);
                total += credit;
            }

            InterestBatchResult result = new InterestBatchResult(batchId, accountTypeCode,
                annualRatePercent, postings.size(), total);

            for (LedgerTransaction posting : postings) {
                auditLog.append(who, AuditAction.INTEREST, AuditEntity.ACCOUNT, posting.getAccountId(),
                    AuditLog.details(
                        "txn_id", posting.getId(),
                        "amount_minor", posting.getAmount(),
                        "batch_id", batchId.toString()));
            }

            auditLog.append(who, AuditAction.INTEREST_BATCH, AuditEntity.ACCOUNT_TYPE, accountTypeCode,
                AuditLog.details(
                    "batch_id", batchId.toString(),
                    "annual_rate_percent", annualRatePercent.toPlainString(),
                    "postings", postings.size(),
                    "total_minor", total));
            for (LedgerTransaction posting : postings) {
                outboxService.saveEvent(TransactionPostedEvent.fromTransaction(posting));
            }
            outboxService.saveEvent(new InterestBatchPostedEvent(UUID.randomUUID(), batchId,
                accountTypeCode, annualRatePercent, postings.size(), total, who, clock.instant()));

            metrics.recordInterestPostings(accountTypeCode, postings.size());
            log.info("Interest batch posted: batchId={}, accountType={}, rate={}%, postings={}, total={}",
                batchId, accountTypeCode, annualRatePercent.toPlainString(), postings.size(), total);
            return result;
        });
    }

    /**
     * The given actor, or the configured default when none is given.
     */
    public String resolveActor(String actor) {
        return (actor == null || actor.isBlank()) ? defaultActor : actor;
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidAmountException("Amount must be positive: " + amount);
        }
    }

    private static void requireActive(LockedAccount account) {
        if (!account.isActive()) {
            throw new AccountNotActiveException(account.getId(), account.getStatus().name());
        }
    }

    private static void requireFunds(LockedAccount account, long amount) {
        if (account.getBalance() < amount) {
            throw new InsufficientFundsException(account.getId(), account.getBalance(), amount);
        }
    }

    /**
     * Runs one operation with the account id in the MDC, records its outcome and latency,
     * and logs rejections. Rejections are rethrown unchanged so the transaction rolls back.
     */
    private <T> T execute(String operation, Long accountId, Supplier<T> work) {
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.MdcScope ignored = accountId != null
                ? CorrelationContext.putScoped(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId)
                : null) {
            try {
                T result = work.get();
                metrics.recordOperation(operation, LedgerMetrics.OUTCOME_SUCCESS, elapsedSince(startTime));
                return result;
            } catch (PessimisticLockingFailureException e) {
                LockContentionException contention =
                    new LockContentionException("Lock not acquired during " + operation, e);
                metrics.recordOperation(operation, contention.getErrorCode().name(), elapsedSince(startTime));
                log.warn("{} rejected: {}", operation, contention.getMessage());
                throw contention;
            } catch (InvariantViolationException e) {
                metrics.recordOperation(operation, e.getErrorCode().name(), elapsedSince(startTime));
                log.error("{} tripped an integrity guard", operation, e);
                throw e;
            } catch (LedgerException e) {
                metrics.recordOperation(operation, e.getErrorCode().name(), elapsedSince(startTime));
                log.warn("{} rejected: code={}, reason={}", operation, e.getErrorCode(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                metrics.recordOperation(operation, "error", elapsedSince(startTime));
                log.error("{} failed unexpectedly", operation, e);
                throw e;
            }
        }
    }

    private static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
