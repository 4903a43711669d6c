package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.loan.Loan;
import com.flagship.budget_ledger.loan.LoanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LoanResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("lender_account_id")
    UUID lenderAccountId;

    @JsonProperty("borrower_account_id")
    UUID borrowerAccountId;

    @JsonProperty("principal")
    BigDecimal principal;

    @JsonProperty("interest_rate")
    BigDecimal interestRate;

    @JsonProperty("outstanding")
    BigDecimal outstanding;

    @JsonProperty("total_interest")
    BigDecimal totalInterest;

    @JsonProperty("status")
    LoanStatus status;

    @JsonProperty("disbursement_transfer_id")
    UUID disbursementTransferId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("paid_at")
    Instant paidAt;

    public static LoanResponse from(Loan loan) {
        return LoanResponse.builder()
            .id(loan.getId())
            .lenderAccountId(loan.getLenderAccountId())
            .borrowerAccountId(loan.getBorrowerAccountId())
            .principal(loan.getPrincipal())
            .interestRate(loan.getInterestRate())
            .outstanding(loan.getOutstanding())
            .totalInterest(loan.getTotalInterest())
            .status(loan.getStatus())
            .disbursementTransferId(loan.getDisbursementTransferId())
            .createdAt(loan.getCreatedAt())
            .updatedAt(loan.getUpdatedAt())
            .paidAt(loan.getPaidAt())
            .build();
    }
}
