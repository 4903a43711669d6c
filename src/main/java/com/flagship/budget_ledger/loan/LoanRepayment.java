package com.flagship.budget_ledger.loan;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class LoanRepayment {
    UUID id;
    UUID loanId;
    UUID periodId;
    BigDecimal amount;
    BigDecimal outstandingAfter;
    UUID transferId;
    Instant createdAt;
}
