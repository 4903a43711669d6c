package com.flagship.budget_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer meters for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions.posted{kind}: ledger rows written
 * - ledger.transfers.posted{kind}: transfers written
 * - ledger.reversals: reversing entries written
 * - allocation.outcomes{status}: per-template results of allocation runs
 * - allocation.run.duration: time spent in runAllocation
 * - loan.events{event}: disbursements, accruals, repayments, payoffs
 * - idempotency.lookups{result}: replayed vs new requests
 * - ledger.command.duration{command}: API command latency
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer allocationRunTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.allocationRunTimer = Timer.builder("allocation.run.duration")
            .description("Time taken to execute an allocation run")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordTransactionPosted(String kind) {
        registry.counter("ledger.transactions.posted", "kind", kind).increment();
    }

    public void recordTransferPosted(String kind) {
        registry.counter("ledger.transfers.posted", "kind", kind).increment();
    }

    public void recordReversal() {
        registry.counter("ledger.reversals").increment();
    }

    public void recordAllocationOutcome(String status) {
        registry.counter("allocation.outcomes", "status", status).increment();
    }

    public <T> T timeAllocationRun(Supplier<T> run) {
        return allocationRunTimer.record(run);
    }

    public void recordLoanEvent(String event) {
        registry.counter("loan.events", "event", event).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.lookups", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.lookups", "result", "miss").increment();
    }

    public void recordCommandLatency(String command, long durationMs) {
        Timer.builder("ledger.command.duration")
            .description("API latency of ledger commands")
            .tag("command", command)
            .register(registry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
