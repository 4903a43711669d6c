package com.flagship.budget_ledger.loan;

import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.exception.OverpaymentException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Loan between two accounts of the same owner.
 *
 * Immutable state machine: every change returns a new Loan.
 * - ACTIVE accrues interest and accepts repayments
 * - PAID is terminal and is reached exactly when outstanding hits zero
 */
@Value
public class Loan {
    public static final String AGGREGATE_TYPE = "Loan";

    UUID id;
    UUID ownerId;
    UUID lenderAccountId;
    UUID borrowerAccountId;
    BigDecimal principal;
    BigDecimal interestRate;
    BigDecimal outstanding;
    BigDecimal totalInterest;
    LoanStatus status;
    UUID disbursementTransferId;
    Instant createdAt;
    Instant updatedAt;
    Instant paidAt;

    /**
     * Creates an ACTIVE loan whose outstanding balance is the principal.
     */
    public static Loan disburse(UUID id, UUID ownerId, UUID lenderAccountId, UUID borrowerAccountId,
                                BigDecimal principal, BigDecimal interestRate, UUID disbursementTransferId) {
        Instant now = Instant.now();
        return new Loan(
            id,
            ownerId,
            lenderAccountId,
            borrowerAccountId,
            principal,
            interestRate,
            principal,
            Money.ZERO,
            LoanStatus.ACTIVE,
            disbursementTransferId,
            now,
            now,
            null
        );
    }

    /**
     * Interest for one period on the current outstanding balance, rounded half-even.
     */
    public BigDecimal interestDue() {
        return Money.round(outstanding.multiply(interestRate));
    }

    /**
     * Adds a period's interest to the outstanding balance.
     *
     * @throws IllegalStateException if the loan is PAID
     */
    public Loan accrue(BigDecimal interest) {
        if (this.status != LoanStatus.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot accrue interest on loan %s in %s status", this.id, this.status));
        }
        return new Loan(
            this.id,
            this.ownerId,
            this.lenderAccountId,
            this.borrowerAccountId,
            this.principal,
            this.interestRate,
            this.outstanding.add(interest),
            this.totalInterest.add(interest),
            this.status,
            this.disbursementTransferId,
            this.createdAt,
            Instant.now(),
            null
        );
    }

    /**
     * Reduces the outstanding balance. Moves to PAID when it reaches zero.
     *
     * @throws OverpaymentException if the loan is already PAID or the amount exceeds the outstanding balance
     */
    public Loan repay(BigDecimal amount) {
        if (this.status == LoanStatus.PAID) {
            throw new OverpaymentException(String.format("Loan %s is already paid", this.id));
        }
        if (amount.compareTo(this.outstanding) > 0) {
            throw new OverpaymentException(String.format(
                "Repayment %s exceeds outstanding balance %s of loan %s",
                amount.toPlainString(), this.outstanding.toPlainString(), this.id));
        }
        BigDecimal remaining = this.outstanding.subtract(amount);
        boolean paidOff = remaining.signum() == 0;
        Instant now = Instant.now();
        return new Loan(
            this.id,
            this.ownerId,
            this.lenderAccountId,
            this.borrowerAccountId,
            this.principal,
            this.interestRate,
            remaining,
            this.totalInterest,
            paidOff ? LoanStatus.PAID : LoanStatus.ACTIVE,
            this.disbursementTransferId,
            this.createdAt,
            now,
            paidOff ? now : null
        );
    }

    public boolean isActive() {
        return this.status == LoanStatus.ACTIVE;
    }

    public boolean isPaid() {
        return this.status == LoanStatus.PAID;
    }
}
