package com.flagship.budget_ledger.settings;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Partial update of owner settings. Null fields keep their current value.
 */
@Value
@Builder
public class ConfigureOwnerCommand {
    LocalDate epochDate;
    DayOfWeek weekStartDay;
    BigDecimal defaultInterestRate;
}
