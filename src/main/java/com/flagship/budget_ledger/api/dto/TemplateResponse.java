package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.allocation.AllocationType;
import com.flagship.budget_ledger.allocation.BudgetTemplate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TemplateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

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

    @JsonProperty("priority")
    int priority;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TemplateResponse from(BudgetTemplate template) {
        return TemplateResponse.builder()
            .id(template.getId())
            .accountId(template.getAccountId())
            .allocationType(template.getAllocationType())
            .fixedAmount(template.getFixedAmount())
            .percentage(template.getPercentage())
            .minAmount(template.getMinAmount())
            .maxAmount(template.getMaxAmount())
            .priority(template.getPriority())
            .active(template.isActive())
            .description(template.getDescription())
            .createdAt(template.getCreatedAt())
            .build();
    }
}
