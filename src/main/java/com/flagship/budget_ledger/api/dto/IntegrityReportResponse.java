package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.IntegrityIssue;
import com.flagship.budget_ledger.account.IntegrityIssueType;
import com.flagship.budget_ledger.account.IntegrityReport;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class IntegrityReportResponse {

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("clean")
    boolean clean;

    @JsonProperty("fix_requested")
    boolean fixRequested;

    @JsonProperty("unresolved_count")
    long unresolvedCount;

    @JsonProperty("issues")
    List<IssueResponse> issues;

    @JsonProperty("checked_at")
    Instant checkedAt;

    @Value
    public static class IssueResponse {

        @JsonProperty("type")
        IntegrityIssueType type;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("detail")
        String detail;

        @JsonProperty("fixed")
        boolean fixed;

        static IssueResponse from(IntegrityIssue issue) {
            return new IssueResponse(issue.getType(), issue.getAccountId(), issue.getAccountName(),
                issue.getDetail(), issue.isFixed());
        }
    }

    public static IntegrityReportResponse from(IntegrityReport report) {
        return new IntegrityReportResponse(
            report.getOwnerId(),
            report.isClean(),
            report.isFixRequested(),
            report.unresolvedCount(),
            report.getIssues().stream().map(IssueResponse::from).toList(),
            report.getCheckedAt());
    }
}
