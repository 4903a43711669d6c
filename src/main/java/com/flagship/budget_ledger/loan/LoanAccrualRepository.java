package com.flagship.budget_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LoanAccrualRepository extends JpaRepository<LoanAccrualEntity, UUID> {

    boolean existsByLoanIdAndPeriodId(UUID loanId, UUID periodId);

    List<LoanAccrualEntity> findByLoanIdOrderByCreatedAtAsc(UUID loanId);
}
