package com.flagship.budget_ledger.allocation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Replaces a template's amounts. A null type keeps the current one; null priority and
 * description keep theirs. Amounts are always taken as given and re-validated.
 */
@Value
@Builder
public class UpdateTemplateCommand {
    AllocationType allocationType;
    BigDecimal fixedAmount;
    BigDecimal percentage;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    Integer priority;
    String description;
}
