package com.flagship.budget_ledger.period;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * A seven-day accounting window {@code [startDate, endDate)}.
 *
 * Whether a period is current depends on the date the caller supplies; it is never stored.
 */
@Value
public class WeeklyPeriod {
    public static final int LENGTH_DAYS = 7;

    UUID id;
    UUID ownerId;
    LocalDate startDate;
    LocalDate endDate;

    public static WeeklyPeriod starting(UUID ownerId, LocalDate startDate) {
        return new WeeklyPeriod(UUID.randomUUID(), ownerId, startDate, startDate.plusDays(LENGTH_DAYS));
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && date.isBefore(endDate);
    }

    public boolean isCurrent(LocalDate today) {
        return contains(today);
    }

    /**
     * Last day that still belongs to the period.
     */
    public LocalDate lastDay() {
        return endDate.minusDays(1);
    }
}
