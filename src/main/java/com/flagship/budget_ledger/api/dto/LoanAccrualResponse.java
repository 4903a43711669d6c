package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.loan.LoanAccrual;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class LoanAccrualResponse {

    @JsonProperty("loan_id")
    UUID loanId;

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("interest")
    BigDecimal interest;

    @JsonProperty("transaction_id")
    UUID transactionId;

    public static LoanAccrualResponse from(LoanAccrual accrual) {
        return new LoanAccrualResponse(accrual.getLoanId(), accrual.getPeriodId(), accrual.getInterest(),
            accrual.getTransactionId());
    }
}
