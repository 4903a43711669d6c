package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.ledger.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when both legs of a transfer have been written.
 */
@Value
public class TransferPostedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "TransferPosted";
    public static final String AGGREGATE_TYPE = "Transfer";

    UUID eventId;
    UUID ownerId;
    UUID transferId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    UUID periodId;
    BigDecimal amount;
    String kind;
    Instant occurredAt;

    @Override
    public UUID getAggregateId() {
        return transferId;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferPostedEvent from(Transfer transfer) {
        return new TransferPostedEvent(
            UUID.randomUUID(),
            transfer.getDebit().getOwnerId(),
            transfer.getTransferId(),
            transfer.getSourceAccountId(),
            transfer.getDestinationAccountId(),
            transfer.getCredit().getPeriodId(),
            transfer.getAmount(),
            transfer.getCredit().getKind().name(),
            Instant.now()
        );
    }
}
