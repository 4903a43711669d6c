package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BalanceResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("as_of_period_id")
    UUID asOfPeriodId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("cached_balance")
    BigDecimal cachedBalance;

    @JsonProperty("subtree_balance")
    BigDecimal subtreeBalance;
}
