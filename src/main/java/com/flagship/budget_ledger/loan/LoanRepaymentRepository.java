package com.flagship.budget_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LoanRepaymentRepository extends JpaRepository<LoanRepaymentEntity, UUID> {

    List<LoanRepaymentEntity> findByLoanIdOrderByCreatedAtAsc(UUID loanId);
}
