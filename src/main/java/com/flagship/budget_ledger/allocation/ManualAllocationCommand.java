package com.flagship.budget_ledger.allocation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ManualAllocationCommand {
    UUID periodId;
    UUID sourceAccountId;
    UUID destinationAccountId;
    BigDecimal amount;
    String notes;
}
