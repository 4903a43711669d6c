package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * A null parent makes the account top-level.
 */
@Value
public class ReparentRequest {

    @JsonProperty("parent_id")
    UUID parentId;
}
