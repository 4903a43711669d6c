package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.DeleteOutcome;
import lombok.Value;

import java.util.UUID;

@Value
public class DeleteAccountResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("outcome")
    DeleteOutcome outcome;
}
