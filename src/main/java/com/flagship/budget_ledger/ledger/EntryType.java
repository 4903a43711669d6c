package com.flagship.budget_ledger.ledger;

import java.math.BigDecimal;

/**
 * Side of a signed ledger amount: credits add to an account, debits subtract.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    public static EntryType of(BigDecimal signedAmount) {
        return signedAmount.signum() < 0 ? DEBIT : CREDIT;
    }
}
