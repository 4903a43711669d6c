package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.loan.LoanRepayment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RepaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("outstanding_after")
    BigDecimal outstandingAfter;

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static RepaymentResponse from(LoanRepayment repayment) {
        return RepaymentResponse.builder()
            .id(repayment.getId())
            .loanId(repayment.getLoanId())
            .periodId(repayment.getPeriodId())
            .amount(repayment.getAmount())
            .outstandingAfter(repayment.getOutstandingAfter())
            .transferId(repayment.getTransferId())
            .createdAt(repayment.getCreatedAt())
            .build();
    }
}
