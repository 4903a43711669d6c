package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.allocation.AllocationType;
import com.flagship.budget_ledger.allocation.UpdateTemplateCommand;
import jakarta.validation.constraints.Min;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class UpdateTemplateRequest {

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

    public UpdateTemplateCommand toCommand() {
        return UpdateTemplateCommand.builder()
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
