package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.AccountCategory;
import com.flagship.budget_ledger.account.CreateAccountCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Category may be omitted under a parent; it is then inherited.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("category")
    AccountCategory category;

    @JsonProperty("parent_id")
    UUID parentId;

    @DecimalMin(value = "0.00", message = "Target amount cannot be negative")
    @JsonProperty("target_amount")
    BigDecimal targetAmount;

    @JsonProperty("sort_order")
    Integer sortOrder;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;

    public CreateAccountCommand toCommand() {
        return CreateAccountCommand.builder()
            .name(name)
            .category(category)
            .parentId(parentId)
            .targetAmount(targetAmount)
            .sortOrder(sortOrder)
            .description(description)
            .build();
    }
}
