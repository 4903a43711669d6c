package com.flagship.budget_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * One structural problem found by the integrity sweep.
 * {@code accountId} is null for issues about something missing.
 */
@Value
public class IntegrityIssue {
    IntegrityIssueType type;
    UUID accountId;
    String accountName;
    String detail;
    boolean fixed;

    public static IntegrityIssue of(IntegrityIssueType type, Account account, String detail) {
        return new IntegrityIssue(type, account.getId(), account.getName(), detail, false);
    }

    public IntegrityIssue markFixed() {
        return new IntegrityIssue(type, accountId, accountName, detail, true);
    }
}
