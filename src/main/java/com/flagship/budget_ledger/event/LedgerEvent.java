package com.flagship.budget_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about the ledger, written to the outbox in the same transaction as the
 * change it describes.
 *
 * The aggregate id is the Kafka key, so events about one transfer, run or loan are
 * delivered in order.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getOwnerId();

    UUID getAggregateId();

    /**
     * Outbox aggregate type: Transfer, AllocationRun or Loan.
     */
    String getAggregateType();

    String getEventType();

    Instant getOccurredAt();
}
