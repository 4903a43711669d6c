package com.flagship.budget_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for loans.
 *
 * Separates persistence from the {@link Loan} state machine: the domain object decides
 * transitions, the entity only stores the result. Parties and principal never change.
 */
@Entity
@Table(name = "loans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "lender_account_id", nullable = false, updatable = false)
    private UUID lenderAccountId;

    @Column(name = "borrower_account_id", nullable = false, updatable = false)
    private UUID borrowerAccountId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principal;

    @Column(name = "interest_rate", nullable = false, updatable = false, precision = 9, scale = 6)
    private BigDecimal interestRate;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal outstanding;

    @Column(name = "total_interest", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalInterest;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LoanStatus status;

    @Column(name = "disbursement_transfer_id", nullable = false, updatable = false)
    private UUID disbursementTransferId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    static LoanEntity fromDomain(Loan loan) {
        return new LoanEntity(
            loan.getId(),
            loan.getOwnerId(),
            loan.getLenderAccountId(),
            loan.getBorrowerAccountId(),
            loan.getPrincipal(),
            loan.getInterestRate(),
            loan.getOutstanding(),
            loan.getTotalInterest(),
            loan.getStatus(),
            loan.getDisbursementTransferId(),
            loan.getCreatedAt(),
            loan.getUpdatedAt(),
            loan.getPaidAt()
        );
    }

    Loan toDomain() {
        return new Loan(id, ownerId, lenderAccountId, borrowerAccountId, principal, interestRate,
            outstanding, totalInterest, status, disbursementTransferId, createdAt, updatedAt, paidAt);
    }

    void updateFromDomain(Loan loan) {
        this.outstanding = loan.getOutstanding();
        this.totalInterest = loan.getTotalInterest();
        this.status = loan.getStatus();
        this.updatedAt = loan.getUpdatedAt();
        this.paidAt = loan.getPaidAt();
    }
}
