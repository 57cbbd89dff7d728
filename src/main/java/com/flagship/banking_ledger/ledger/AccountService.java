package com.flagship.banking_ledger.ledger;

import com.flagship.banking_ledger.audit.AuditAction;
import com.flagship.banking_ledger.audit.AuditEntity;
import com.flagship.banking_ledger.audit.AuditLog;
import com.flagship.banking_ledger.audit.AuditRecord;
import com.flagship.banking_ledger.event.AccountLifecycleEvent;
import com.flagship.banking_ledger.ledger.exception.InvalidAmountException;
import com.flagship.banking_ledger.ledger.exception.InvalidStateTransitionException;
import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import com.flagship.banking_ledger.observability.CorrelationContext;
import com.flagship.banking_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Account lifecycle and the read side of the ledger.
 *
 * Opening an account, optionally with an initial deposit, and status changes
 * (freeze, unfreeze, close) each run as one atomic unit with their audit record and
 * outbox event. Money movement is delegated to {@link TransactionEngine}.
 */
@Service
@Slf4j
public class AccountService {

    static final String INITIAL_DEPOSIT_REFERENCE = "Initial Deposit";

    private final AccountStore accountStore;
    private final TransactionEngine engine;
    private final TransactionLedger ledger;
    private final AuditLog auditLog;
    private final OutboxService outboxService;
    private final LockWaitPolicy lockWaitPolicy;
    private final Clock clock;

    public AccountService(AccountStore accountStore,
                          TransactionEngine engine,
                          TransactionLedger ledger,
                          AuditLog auditLog,
                          OutboxService outboxService,
                          LockWaitPolicy lockWaitPolicy,
                          Clock clock) {
        this.accountStore = accountStore;
        this.engine = engine;
        this.ledger = ledger;
        this.auditLog = auditLog;
        this.outboxService = outboxService;
        this.lockWaitPolicy = lockWaitPolicy;
        this.clock = clock;
    }

    @Transactional
    public Account openAccount(long customerId, long branchId, String accountTypeCode, String actor) {
        return openAccount(customerId, branchId, accountTypeCode, 0L, actor);
    }

    /**
     * Opens an ACTIVE account and, when {@code initialDeposit} is positive, deposits it with
     * reference "Initial Deposit". Both happen in one transaction.
     *
     * @return the account as it stands after the initial deposit
     */
    @Transactional
    public Account openAccount(long customerId, long branchId, String accountTypeCode,
                               long initialDeposit, String actor) {
        if (initialDeposit < 0) {
            throw new InvalidAmountException("Initial deposit cannot be negative: " + initialDeposit);
        }
        String who = engine.resolveActor(actor);

        Account account = accountStore.open(customerId, branchId, accountTypeCode);
        try (CorrelationContext.MdcScope ignored =
                 CorrelationContext.putScoped(CorrelationContext.ACCOUNT_ID_MDC_KEY, account.getId())) {

            auditLog.append(who, AuditAction.CREATE, AuditEntity.ACCOUNT, account.getId(),
                AuditLog.details("account_no", account.getAccountNumber(), "account_type", accountTypeCode));
            outboxService.saveEvent(AccountLifecycleEvent.opened(account, who));

            log.info("Account opened: accountNo={}, customerId={}, type={}",
                account.getAccountNumber(), customerId, accountTypeCode);

            if (initialDeposit > 0) {
                engine.deposit(account.getId(), initialDeposit, INITIAL_DEPOSIT_REFERENCE, who);
                return new Account(account.getId(), account.getAccountNumber(), customerId, branchId,
                    account.getAccountTypeId(), initialDeposit, AccountStatus.ACTIVE,
                    account.getOpenedAt(), null);
            }
            return account;
        }
    }

    @Transactional
    public Account freeze(long accountId, String actor) {
        return changeStatus(accountId, AccountStatus.FROZEN, actor);
    }

    @Transactional
    public Account unfreeze(long accountId, String actor) {
        return changeStatus(accountId, AccountStatus.ACTIVE, actor);
    }

    /**
     * Closes an ACTIVE account. The balance must be zero; closing is terminal.
     */
    @Transactional
    public Account close(long accountId, String actor) {
        return changeStatus(accountId, AccountStatus.CLOSED, actor);
    }

    @Transactional(readOnly = true)
    public Account getAccount(long accountId) {
        return accountStore.findById(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactions(long accountId) {
        getAccount(accountId);
        return ledger.findByAccount(accountId);
    }

    @Transactional(readOnly = true)
    public List<AuditRecord> getAuditTrail(AuditEntity entity, String entityId) {
        return auditLog.findByEntity(entity, entityId);
    }

    private Account changeStatus(long accountId, AccountStatus target, String actor) {
        String who = engine.resolveActor(actor);
        try (CorrelationContext.MdcScope ignored =
                 CorrelationContext.putScoped(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId)) {
            lockWaitPolicy.apply();
            LockedAccount account = accountStore.getForUpdate(accountId);
            AccountStatus current = account.getStatus();

            if (!current.canTransitionTo(target)) {
                log.warn("Status change rejected: {} -> {}", current, target);
                throw new InvalidStateTransitionException(String.format(
                    "Account %d cannot move from %s to %s", accountId, current, target));
            }
            if (target == AccountStatus.CLOSED && account.getBalance() != 0) {
                log.warn("Close rejected: balance={}", account.getBalance());
                throw new InvalidStateTransitionException(String.format(
                    "Account %d cannot be closed with balance %d", accountId, account.getBalance()));
            }

            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            accountStore.updateStatus(accountId, target, target == AccountStatus.CLOSED ? now : null);

            auditLog.append(who, AuditAction.STATUS_CHANGE, AuditEntity.ACCOUNT, accountId,
                AuditLog.details("from", current.name(), "to", target.name()));
            outboxService.saveEvent(AccountLifecycleEvent.statusChanged(accountId, account.getAccountNumber(),
                current, target, who, now));

            log.info("Account status changed: {} -> {}", current, target);
            return getAccount(accountId);
        }
    }
}
