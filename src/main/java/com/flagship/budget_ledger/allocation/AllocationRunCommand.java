package com.flagship.budget_ledger.allocation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AllocationRunCommand {
    UUID periodId;
    UUID sourceAccountId;
    /** Null distributes the period's income on the source account. */
    BigDecimal pool;
    boolean reprocess;
}
