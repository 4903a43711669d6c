package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.ledger.TransactionKind;
import com.flagship.budget_ledger.ledger.TransferCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class TransferRequest {

    @NotNull(message = "Source account ID is required")
    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @NotNull(message = "Destination account ID is required")
    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @NotNull(message = "Period ID is required")
    @JsonProperty("period_id")
    UUID periodId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("description")
    String description;

    public TransferCommand toCommand() {
        return TransferCommand.builder()
            .sourceAccountId(sourceAccountId)
            .destinationAccountId(destinationAccountId)
            .periodId(periodId)
            .amount(amount)
            .kind(kind)
            .description(description)
            .build();
    }
}
