package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

/**
 * Without a loan id, every active loan of the owner is accrued.
 */
@Value
public class AccrueInterestRequest {

    @NotNull(message = "Period ID is required")
    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("loan_id")
    UUID loanId;
}
