package com.flagship.budget_ledger.allocation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class CreateTemplateCommand {
    UUID accountId;
    AllocationType allocationType;
    BigDecimal fixedAmount;
    BigDecimal percentage;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    Integer priority;
    String description;
}
