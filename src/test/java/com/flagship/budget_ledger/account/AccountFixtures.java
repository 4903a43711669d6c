package com.flagship.budget_ledger.account;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * In-memory accounts for tests that do not touch the database.
 */
final class AccountFixtures {

    private AccountFixtures() {
    }

    static Account root(UUID ownerId, AccountCategory category) {
        return new Account(UUID.randomUUID(), ownerId, category.defaultRootName(), category, null, true,
            null, BigDecimal.ZERO, true, 0, null, Instant.EPOCH);
    }

    static Account child(UUID ownerId, String name, AccountCategory category, UUID parentId) {
        return new Account(UUID.randomUUID(), ownerId, name, category, parentId, false,
            null, BigDecimal.ZERO, true, 0, null, Instant.EPOCH);
    }

    static Account withParent(Account account, UUID parentId) {
        return new Account(account.getId(), account.getOwnerId(), account.getName(), account.getCategory(), parentId,
            account.isRootAccount(), account.getTargetAmount(), account.getCurrentBalance(), account.isActive(),
            account.getSortOrder(), account.getDescription(), account.getCreatedAt());
    }

    static Account withBalance(Account account, String balance) {
        return new Account(account.getId(), account.getOwnerId(), account.getName(), account.getCategory(),
            account.getParentId(), account.isRootAccount(), account.getTargetAmount(), new BigDecimal(balance),
            account.isActive(), account.getSortOrder(), account.getDescription(), account.getCreatedAt());
    }

    static Account withSortOrder(Account account, int sortOrder) {
        return new Account(account.getId(), account.getOwnerId(), account.getName(), account.getCategory(),
            account.getParentId(), account.isRootAccount(), account.getTargetAmount(), account.getCurrentBalance(),
            account.isActive(), sortOrder, account.getDescription(), account.getCreatedAt());
    }
}
