package com.flagship.budget_ledger.loan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A null interest rate falls back to the owner's default.
 */
@Value
@Builder
public class DisburseLoanCommand {
    UUID lenderAccountId;
    UUID borrowerAccountId;
    BigDecimal principal;
    BigDecimal interestRate;
    UUID periodId;
    String description;
}
