package com.flagship.banking_ledger.loan;

import com.flagship.banking_ledger.ledger.exception.LockContentionException;
import com.flagship.banking_ledger.ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Bridges the loan domain objects and their JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanPersistenceService {

    private final LoanRepository loanRepository;
    private final LoanPaymentRepository paymentRepository;

    /**
     * Inserts a new loan and flushes, so the row exists before any money moves for it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan save(Loan loan) {
        LoanEntity saved = loanRepository.saveAndFlush(LoanEntity.fromDomain(loan));
        log.debug("Saved loan {} in status {}", saved.getId(), saved.getStatus());
        return saved.toDomain();
    }

    /**
     * Locks the loan row for the rest of the transaction.
     *
     * @throws LockContentionException if the lock is not granted within the lock timeout
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Loan> findByIdForUpdate(long loanId) {
        try {
            return loanRepository.findByIdForUpdate(loanId).map(LoanEntity::toDomain);
        } catch (PessimisticLockingFailureException e) {
            throw new LockContentionException("Could not lock loan " + loanId, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Loan> findById(long loanId) {
        return loanRepository.findById(loanId).map(LoanEntity::toDomain);
    }

    /**
     * Writes the mutable part of the loan: amounts, status and closing time.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan update(Loan loan) {
        LoanEntity existing = loanRepository.findById(loan.getId())
            .orElseThrow(() -> new NotFoundException("Loan", loan.getId()));
        existing.updateFromDomain(loan);
        LoanEntity updated = loanRepository.saveAndFlush(existing);
        log.debug("Updated loan {} to status {}, outstanding {}",
            updated.getId(), updated.getStatus(), updated.getOutstanding());
        return updated.toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public LoanPayment savePayment(LoanPayment payment) {
        LoanPaymentEntity saved = paymentRepository.save(LoanPaymentEntity.fromDomain(payment));
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<LoanPayment> findPayments(long loanId) {
        return paymentRepository.findByLoanIdOrderByIdAsc(loanId)
            .stream()
            .map(LoanPaymentEntity::toDomain)
            .toList();
    }
}
