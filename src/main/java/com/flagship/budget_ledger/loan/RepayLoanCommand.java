package com.flagship.budget_ledger.loan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class RepayLoanCommand {
    UUID loanId;
    BigDecimal amount;
    UUID periodId;
}
