package com.flagship.budget_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for loan accruals. Insert-only.
 */
@Entity
@Table(name = "loan_accruals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanAccrualEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "period_id", nullable = false, updatable = false)
    private UUID periodId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal interest;

    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LoanAccrualEntity fromDomain(LoanAccrual accrual) {
        return new LoanAccrualEntity(accrual.getId(), accrual.getLoanId(), accrual.getPeriodId(),
            accrual.getInterest(), accrual.getTransactionId(), accrual.getCreatedAt());
    }

    LoanAccrual toDomain() {
        return new LoanAccrual(id, loanId, periodId, interest, transactionId, createdAt);
    }
}
