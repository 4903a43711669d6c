package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class RenameRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;
}
