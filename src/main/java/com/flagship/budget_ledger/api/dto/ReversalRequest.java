package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ReversalRequest {

    @JsonProperty("description")
    String description;
}
