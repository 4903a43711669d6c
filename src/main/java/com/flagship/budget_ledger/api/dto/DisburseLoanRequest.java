package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.loan.DisburseLoanCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class DisburseLoanRequest {

    @NotNull(message = "Lender account ID is required")
    @JsonProperty("lender_account_id")
    UUID lenderAccountId;

    @NotNull(message = "Borrower account ID is required")
    @JsonProperty("borrower_account_id")
    UUID borrowerAccountId;

    @NotNull(message = "Principal is required")
    @DecimalMin(value = "0.01", message = "Principal must be greater than 0")
    @JsonProperty("principal")
    BigDecimal principal;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @NotNull(message = "Period ID is required")
    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("description")
    String description;

    public DisburseLoanCommand toCommand() {
        return DisburseLoanCommand.builder()
            .lenderAccountId(lenderAccountId)
            .borrowerAccountId(borrowerAccountId)
            .principal(principal)
            .interestRate(interestRate)
            .periodId(periodId)
            .description(description)
            .build();
    }
}
