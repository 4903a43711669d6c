package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.allocation.Allocation;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AllocationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("run_id")
    UUID runId;

    @JsonProperty("template_id")
    UUID templateId;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;

    @JsonProperty("partially_funded")
    boolean partiallyFunded;

    @JsonProperty("processed")
    boolean processed;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("reversal_transfer_id")
    UUID reversalTransferId;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AllocationResponse from(Allocation allocation) {
        return AllocationResponse.builder()
            .id(allocation.getId())
            .runId(allocation.getRunId())
            .templateId(allocation.getTemplateId())
            .sourceAccountId(allocation.getSourceAccountId())
            .destinationAccountId(allocation.getDestinationAccountId())
            .periodId(allocation.getPeriodId())
            .amount(allocation.getAmount())
            .requestedAmount(allocation.getRequestedAmount())
            .partiallyFunded(allocation.isPartiallyFunded())
            .processed(allocation.isProcessed())
            .transferId(allocation.getTransferId())
            .reversalTransferId(allocation.getReversalTransferId())
            .notes(allocation.getNotes())
            .createdAt(allocation.getCreatedAt())
            .build();
    }
}
