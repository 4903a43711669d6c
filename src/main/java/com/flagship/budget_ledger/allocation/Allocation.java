package com.flagship.budget_ledger.allocation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Money moved from a pool to a destination, backed by one transfer.
 *
 * templateId is null for manual allocations; runId is null for allocations made
 * outside a run. A processed allocation that gets reprocessed keeps its row and
 * records the transfer that reversed it.
 */
@Value
public class Allocation {
    UUID id;
    UUID ownerId;
    UUID runId;
    UUID templateId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    UUID periodId;
    BigDecimal amount;
    BigDecimal requestedAmount;
    boolean partiallyFunded;
    boolean processed;
    UUID transferId;
    UUID reversalTransferId;
    String notes;
    Instant createdAt;

    public boolean isManual() {
        return templateId == null;
    }
}
