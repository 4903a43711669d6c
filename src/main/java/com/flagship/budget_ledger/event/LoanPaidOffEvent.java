package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.loan.Loan;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a repayment brings the outstanding balance to zero.
 */
@Value
public class LoanPaidOffEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "LoanPaidOff";

    UUID eventId;
    UUID ownerId;
    UUID loanId;
    UUID lenderAccountId;
    UUID borrowerAccountId;
    BigDecimal principal;
    BigDecimal outstanding;
    BigDecimal totalInterest;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return loanId;
    }

    @Override
    public String getAggregateType() {
        return Loan.AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LoanPaidOffEvent from(Loan loan) {
        return new LoanPaidOffEvent(
            UUID.randomUUID(),
            loan.getOwnerId(),
            loan.getId(),
            loan.getLenderAccountId(),
            loan.getBorrowerAccountId(),
            loan.getPrincipal(),
            loan.getOutstanding(),
            loan.getTotalInterest(),
            Instant.now()
        );
    }
}
