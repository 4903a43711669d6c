package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.allocation.AllocationRunCommand;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * When pool is omitted, the period's income on the source account is distributed.
 */
@Value
public class AllocationRunRequest {

    @NotNull(message = "Period ID is required")
    @JsonProperty("period_id")
    UUID periodId;

    @NotNull(message = "Source account ID is required")
    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("pool")
    BigDecimal pool;

    @JsonProperty("reprocess")
    boolean reprocess;

    public AllocationRunCommand toCommand() {
        return AllocationRunCommand.builder()
            .periodId(periodId)
            .sourceAccountId(sourceAccountId)
            .pool(pool)
            .reprocess(reprocess)
            .build();
    }
}
