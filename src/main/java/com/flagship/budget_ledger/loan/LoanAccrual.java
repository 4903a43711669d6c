package com.flagship.budget_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Interest charged to a loan for one period. transactionId is null when no ledger entry
 * was posted (zero interest, or outstanding-only bookkeeping).
 */
@Value
public class LoanAccrual {
    UUID id;
    UUID loanId;
    UUID periodId;
    BigDecimal interest;
    UUID transactionId;
    Instant createdAt;
}
