package com.flagship.budget_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A node in an owner's chart of accounts.
 *
 * Key invariants:
 * 1. Following parent links never revisits an account (no cycles)
 * 2. The category equals the category of the root ancestor
 * 3. currentBalance equals the signed sum of the account's ledger transactions
 * 4. Root accounts never have a parent
 *
 * currentBalance is a cache maintained in the same database transaction as every
 * ledger write; the ledger itself stays the source of truth.
 */
@Value
public class Account {
    UUID id;
    UUID ownerId;
    String name;
    AccountCategory category;
    UUID parentId;
    boolean rootAccount;
    BigDecimal targetAmount;
    BigDecimal currentBalance;
    boolean active;
    int sortOrder;
    String description;
    Instant createdAt;

    public boolean isTopLevel() {
        return parentId == null;
    }

    public boolean isGoal() {
        return targetAmount != null;
    }
}
