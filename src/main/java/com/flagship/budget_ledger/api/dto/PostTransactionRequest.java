package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.ledger.PostTransactionCommand;
import com.flagship.budget_ledger.ledger.TransactionKind;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Signed amount: positive credits the account, negative debits it.
 */
@Value
public class PostTransactionRequest {

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    UUID accountId;

    @NotNull(message = "Period ID is required")
    @JsonProperty("period_id")
    UUID periodId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("description")
    String description;

    public PostTransactionCommand toCommand() {
        return PostTransactionCommand.builder()
            .accountId(accountId)
            .periodId(periodId)
            .amount(amount)
            .kind(kind)
            .description(description)
            .build();
    }
}
