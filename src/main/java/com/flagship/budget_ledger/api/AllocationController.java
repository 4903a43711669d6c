package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.allocation.AllocationEngine;
import com.flagship.budget_ledger.allocation.AllocationRun;
import com.flagship.budget_ledger.api.dto.AllocationResponse;
import com.flagship.budget_ledger.api.dto.AllocationRunRequest;
import com.flagship.budget_ledger.api.dto.AllocationRunResponse;
import com.flagship.budget_ledger.api.dto.ManualAllocationRequest;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Allocation runs and manual allocations.
 *
 * Runs need no idempotency key: rerunning a period funds only the templates that were
 * not funded yet.
 */
@RestController
@RequestMapping("/api/owners/{ownerId}/allocations")
@RequiredArgsConstructor
@Slf4j
public class AllocationController {

    private final AllocationEngine allocationEngine;
    private final LedgerMetrics metrics;

    /**
     * Without an explicit pool, the period's income on the source account is distributed.
     */
    @PostMapping("/runs")
    public ResponseEntity<AllocationRunResponse> runAllocation(@PathVariable("ownerId") UUID ownerId,
                                                               @Valid @RequestBody AllocationRunRequest request) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(request.getSourceAccountId());

        log.info("Received allocation run request: periodId={}, pool={}, reprocess={}",
            request.getPeriodId(), request.getPool() != null ? request.getPool() : "period activity",
            request.isReprocess());

        AllocationRun run = allocationEngine.runAllocation(ownerId, request.toCommand());

        metrics.recordCommandLatency("run_allocation", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(HttpStatus.CREATED).body(AllocationRunResponse.from(run));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<AllocationRunResponse>> listRuns(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam(name = "period_id", required = false) UUID periodId) {
        return ResponseEntity.ok(allocationEngine.listRuns(ownerId, periodId).stream()
            .map(AllocationRunResponse::from)
            .toList());
    }

    @PostMapping("/manual")
    public ResponseEntity<AllocationResponse> allocateManually(@PathVariable("ownerId") UUID ownerId,
                                                               @Valid @RequestBody ManualAllocationRequest request) {
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(request.getSourceAccountId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AllocationResponse.from(allocationEngine.allocateManually(ownerId, request.toCommand())));
    }

    @GetMapping
    public ResponseEntity<List<AllocationResponse>> listAllocations(@PathVariable("ownerId") UUID ownerId,
                                                                    @RequestParam("period_id") UUID periodId) {
        return ResponseEntity.ok(allocationEngine.listAllocations(ownerId, periodId).stream()
            .map(AllocationResponse::from)
            .toList());
    }
}
