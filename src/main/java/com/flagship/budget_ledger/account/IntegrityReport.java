package com.flagship.budget_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class IntegrityReport {
    UUID ownerId;
    List<IntegrityIssue> issues;
    boolean fixRequested;
    Instant checkedAt;

    public boolean isClean() {
        return issues.isEmpty();
    }

    public long unresolvedCount() {
        return issues.stream().filter(issue -> !issue.isFixed()).count();
    }
}
