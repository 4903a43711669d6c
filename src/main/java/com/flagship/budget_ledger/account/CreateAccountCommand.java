package com.flagship.budget_ledger.account;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input for {@link AccountService#createAccount}.
 * A null category under a parent inherits the parent's category.
 */
@Value
@Builder
public class CreateAccountCommand {
    String name;
    AccountCategory category;
    UUID parentId;
    BigDecimal targetAmount;
    Integer sortOrder;
    String description;
}
