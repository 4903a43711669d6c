package com.flagship.budget_ledger.account;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Detects structural problems in an owner's accounts.
 *
 * Pure: takes the owner's accounts and the ledger-folded balances and returns the
 * issues found. Nothing is changed here; {@link IntegrityService} applies the fixes.
 */
public final class IntegrityValidator {

    static final List<AccountCategory> REQUIRED_ROOTS = List.of(AccountCategory.INCOME, AccountCategory.EXPENSE);

    private IntegrityValidator() {
    }

    public static List<IntegrityIssue> validate(List<Account> accounts, Map<UUID, BigDecimal> foldedBalances) {
        AccountHierarchy hierarchy = AccountHierarchy.of(accounts);
        List<IntegrityIssue> issues = new ArrayList<>();

        for (Account account : accounts) {
            UUID parentId = account.getParentId();
            if (parentId == null) {
                continue;
            }
            if (account.isRootAccount()) {
                issues.add(IntegrityIssue.of(IntegrityIssueType.ROOT_WITH_PARENT, account,
                    "Root account has parent " + parentId));
                continue;
            }
            Account parent = hierarchy.get(parentId).orElse(null);
            if (parent == null) {
                issues.add(IntegrityIssue.of(IntegrityIssueType.ORPHANED, account,
                    "Parent " + parentId + " is missing or belongs to another owner"));
            } else if (parent.getCategory() != account.getCategory()) {
                issues.add(IntegrityIssue.of(IntegrityIssueType.CATEGORY_MISMATCH, account,
                    String.format("Category %s differs from parent '%s' category %s",
                        account.getCategory(), parent.getName(), parent.getCategory())));
            }
        }

        for (Set<UUID> cycle : findCycles(hierarchy)) {
            UUID representative = cycle.stream().min(Comparator.naturalOrder()).orElseThrow();
            Account account = hierarchy.get(representative).orElseThrow();
            issues.add(IntegrityIssue.of(IntegrityIssueType.CYCLE, account,
                "Parent chain loops through " + cycle.size() + " account(s)"));
        }

        for (Account account : accounts) {
            BigDecimal folded = foldedBalances.getOrDefault(account.getId(), BigDecimal.ZERO);
            if (account.getCurrentBalance().compareTo(folded) != 0) {
                issues.add(IntegrityIssue.of(IntegrityIssueType.BALANCE_DRIFT, account,
                    String.format("Cached balance %s, ledger balance %s",
                        account.getCurrentBalance().toPlainString(), folded.toPlainString())));
            }
        }

        for (AccountCategory category : REQUIRED_ROOTS) {
            boolean present = accounts.stream()
                .anyMatch(account -> account.isRootAccount() && account.isActive() && account.getCategory() == category);
            if (!present) {
                issues.add(new IntegrityIssue(IntegrityIssueType.MISSING_DEFAULT_ACCOUNT, null,
                    category.defaultRootName(), "No active " + category + " root account", false));
            }
        }

        return issues;
    }

    /**
     * Every distinct parent-link loop, as the set of its members.
     */
    static List<Set<UUID>> findCycles(AccountHierarchy hierarchy) {
        List<Set<UUID>> cycles = new ArrayList<>();
        Set<UUID> inKnownCycle = new HashSet<>();
        Set<UUID> cleared = new HashSet<>();

        for (Account start : hierarchy.all()) {
            LinkedHashSet<UUID> path = new LinkedHashSet<>();
            UUID cursor = start.getId();
            while (cursor != null && !cleared.contains(cursor) && !inKnownCycle.contains(cursor) && path.add(cursor)) {
                cursor = hierarchy.get(cursor).map(Account::getParentId).orElse(null);
            }
            if (cursor != null && path.contains(cursor)) {
                Set<UUID> cycle = new LinkedHashSet<>();
                boolean inLoop = false;
                for (UUID id : path) {
                    if (id.equals(cursor)) {
                        inLoop = true;
                    }
                    if (inLoop) {
                        cycle.add(id);
                    }
                }
                cycles.add(cycle);
                inKnownCycle.addAll(cycle);
                path.removeAll(cycle);
            }
            cleared.addAll(path);
        }
        return cycles;
    }
}
