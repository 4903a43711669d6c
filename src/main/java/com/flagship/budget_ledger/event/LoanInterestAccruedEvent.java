package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.loan.Loan;
import com.flagship.budget_ledger.loan.LoanAccrual;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for each accrual, including zero-interest ones.
 */
@Value
public class LoanInterestAccruedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "LoanInterestAccrued";

    UUID eventId;
    UUID ownerId;
    UUID loanId;
    UUID periodId;
    BigDecimal interest;
    BigDecimal outstanding;
    UUID transactionId;
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

    public static LoanInterestAccruedEvent from(Loan loan, LoanAccrual accrual) {
        return new LoanInterestAccruedEvent(
            UUID.randomUUID(),
            loan.getOwnerId(),
            loan.getId(),
            accrual.getPeriodId(),
            accrual.getInterest(),
            loan.getOutstanding(),
            accrual.getTransactionId(),
            Instant.now()
        );
    }
}
