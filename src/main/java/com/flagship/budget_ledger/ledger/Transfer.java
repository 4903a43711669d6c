package com.flagship.budget_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The two legs of a transfer: the debit on the source and the credit on the destination.
 */
@Value
public class Transfer {
    UUID transferId;
    LedgerTransaction debit;
    LedgerTransaction credit;

    public BigDecimal getAmount() {
        return credit.getAmount();
    }

    public UUID getSourceAccountId() {
        return debit.getAccountId();
    }

    public UUID getDestinationAccountId() {
        return credit.getAccountId();
    }
}
