package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.allocation.AllocationOutcome;
import com.flagship.budget_ledger.allocation.AllocationRun;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AllocationRunResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("pool")
    BigDecimal pool;

    @JsonProperty("total_allocated")
    BigDecimal totalAllocated;

    @JsonProperty("remaining_pool")
    BigDecimal remainingPool;

    @JsonProperty("reprocess")
    boolean reprocess;

    @JsonProperty("funded_count")
    int fundedCount;

    @JsonProperty("skipped_count")
    int skippedCount;

    @JsonProperty("failed_count")
    int failedCount;

    @JsonProperty("outcomes")
    List<AllocationOutcome> outcomes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AllocationRunResponse from(AllocationRun run) {
        return AllocationRunResponse.builder()
            .id(run.getId())
            .periodId(run.getPeriodId())
            .sourceAccountId(run.getSourceAccountId())
            .pool(run.getPool())
            .totalAllocated(run.getTotalAllocated())
            .remainingPool(run.getRemainingPool())
            .reprocess(run.isReprocess())
            .fundedCount(run.countFunded())
            .skippedCount(run.countSkipped())
            .failedCount(run.countFailed())
            .outcomes(run.getOutcomes())
            .createdAt(run.getCreatedAt())
            .build();
    }
}
