package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.allocation.AllocationType;
import com.flagship.budget_ledger.allocation.CreateTemplateCommand;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Only the amount fields of the chosen allocation type are read.
 */
@Value
public class CreateTemplateRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @NotNull(message = "Allocation type is required")
    @JsonProperty("allocation_type")
    AllocationType allocationType;

    @JsonProperty("fixed_amount")
    BigDecimal fixedAmount;

    @JsonProperty("percentage")
    BigDecimal percentage;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @Min(value = 0, message = "Priority cannot be negative")
    @JsonProperty("priority")
    Integer priority;

    @JsonProperty("description")
    String description;

    public CreateTemplateCommand toCommand() {
        return CreateTemplateCommand.builder()
            .accountId(accountId)
            .allocationType(allocationType)
            .fixedAmount(fixedAmount)
            .percentage(percentage)
            .minAmount(minAmount)
            .maxAmount(maxAmount)
            .priority(priority)
            .description(description)
            .build();
    }
}
