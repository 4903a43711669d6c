package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.ledger.EntryType;
import com.flagship.budget_ledger.ledger.LedgerTransaction;
import com.flagship.budget_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("description")
    String description;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("reverses_id")
    UUID reversesId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountId(transaction.getAccountId())
            .periodId(transaction.getPeriodId())
            .amount(transaction.getAmount())
            .entryType(transaction.getEntryType())
            .kind(transaction.getKind())
            .description(transaction.getDescription())
            .transferId(transaction.getTransferId())
            .reversesId(transaction.getReversesId())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
