package com.flagship.budget_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One immutable ledger row.
 *
 * The amount is signed and never zero. Both legs of a transfer share a transferId.
 * Corrections are new rows pointing at the corrected one through reversesId.
 */
@Value
public class LedgerTransaction {
    UUID id;
    UUID ownerId;
    UUID accountId;
    UUID periodId;
    BigDecimal amount;
    TransactionKind kind;
    String description;
    UUID transferId;
    UUID reversesId;
    Instant createdAt;
    Long sequenceNumber;

    /**
     * A row ready to be appended. Timestamp and sequence are assigned by the database.
     */
    public static LedgerTransaction draft(UUID ownerId, UUID accountId, UUID periodId, BigDecimal amount,
                                          TransactionKind kind, String description,
                                          UUID transferId, UUID reversesId) {
        return new LedgerTransaction(UUID.randomUUID(), ownerId, accountId, periodId, amount, kind,
            description, transferId, reversesId, null, null);
    }

    LedgerTransaction persisted(Instant createdAt, long sequenceNumber) {
        return new LedgerTransaction(id, ownerId, accountId, periodId, amount, kind, description,
            transferId, reversesId, createdAt, sequenceNumber);
    }

    public EntryType getEntryType() {
        return EntryType.of(amount);
    }

    public boolean isTransferLeg() {
        return transferId != null;
    }

    public boolean isReversal() {
        return reversesId != null;
    }
}
