package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountCategory;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("category")
    AccountCategory category;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("root_account")
    boolean rootAccount;

    @JsonProperty("target_amount")
    BigDecimal targetAmount;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("sort_order")
    int sortOrder;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .category(account.getCategory())
            .parentId(account.getParentId())
            .rootAccount(account.isRootAccount())
            .targetAmount(account.getTargetAmount())
            .currentBalance(account.getCurrentBalance())
            .active(account.isActive())
            .sortOrder(account.getSortOrder())
            .description(account.getDescription())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
