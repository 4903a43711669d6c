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
 * JPA entity for loan repayments. Insert-only.
 */
@Entity
@Table(name = "loan_repayments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanRepaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "period_id", nullable = false, updatable = false)
    private UUID periodId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "outstanding_after", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal outstandingAfter;

    @Column(name = "transfer_id", nullable = false, updatable = false)
    private UUID transferId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LoanRepaymentEntity fromDomain(LoanRepayment repayment) {
        return new LoanRepaymentEntity(repayment.getId(), repayment.getLoanId(), repayment.getPeriodId(),
            repayment.getAmount(), repayment.getOutstandingAfter(), repayment.getTransferId(),
            repayment.getCreatedAt());
    }

    LoanRepayment toDomain() {
        return new LoanRepayment(id, loanId, periodId, amount, outstandingAfter, transferId, createdAt);
    }
}
