package com.flagship.banking_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LoanPaymentRepository extends JpaRepository<LoanPaymentEntity, Long> {

    List<LoanPaymentEntity> findByLoanIdOrderByIdAsc(long loanId);
}
