package com.flagship.budget_ledger.settings;

import lombok.Value;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Per-owner engine configuration.
 *
 * {@code epochDate} is optional: without it, the first weekly period is anchored on the
 * creation date of the owner's earliest account.
 */
@Value
public class OwnerSettings {
    public static final BigDecimal DEFAULT_INTEREST_RATE = new BigDecimal("0.0200");

    UUID ownerId;
    LocalDate epochDate;
    DayOfWeek weekStartDay;
    BigDecimal defaultInterestRate;

    public static OwnerSettings defaults(UUID ownerId, DayOfWeek weekStartDay) {
        return new OwnerSettings(ownerId, null, weekStartDay, DEFAULT_INTEREST_RATE);
    }
}
