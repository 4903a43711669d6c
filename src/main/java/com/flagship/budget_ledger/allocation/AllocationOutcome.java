package com.flagship.budget_ledger.allocation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * What happened to one template in a run. Stored as JSON on the run record.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AllocationOutcome {
    @JsonProperty("template_id")
    UUID templateId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("allocation_type")
    AllocationType allocationType;

    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;

    @JsonProperty("allocated_amount")
    BigDecimal allocatedAmount;

    @JsonProperty("status")
    OutcomeStatus status;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    @JsonProperty("message")
    String message;

    @JsonProperty("allocation_id")
    UUID allocationId;

    /**
     * True when the outcome moves money and needs a transfer.
     */
    public boolean requiresTransfer() {
        return status.isFunded() && allocatedAmount != null && allocatedAmount.signum() > 0;
    }
}
