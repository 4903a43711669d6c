package com.flagship.budget_ledger.period;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Date arithmetic for weekly periods. No storage access.
 */
public final class PeriodCalendar {

    private PeriodCalendar() {
    }

    /**
     * The latest {@code weekStart} day on or before {@code date}.
     */
    public static LocalDate alignToWeekStart(LocalDate date, DayOfWeek weekStart) {
        return date.with(TemporalAdjusters.previousOrSame(weekStart));
    }

    /**
     * Start of the period containing {@code date} in a sequence anchored at {@code anchorStart}.
     * {@code date} must not be before the anchor.
     */
    public static LocalDate startContaining(LocalDate anchorStart, LocalDate date) {
        if (date.isBefore(anchorStart)) {
            throw new IllegalArgumentException("Date " + date + " precedes anchor " + anchorStart);
        }
        long days = ChronoUnit.DAYS.between(anchorStart, date);
        return anchorStart.plusDays(days - days % WeeklyPeriod.LENGTH_DAYS);
    }

    /**
     * Start dates of the contiguous periods from {@code firstStart} up to and including
     * the one containing {@code date}. Empty when {@code date} precedes {@code firstStart}.
     */
    public static List<LocalDate> startsThrough(LocalDate firstStart, LocalDate date) {
        List<LocalDate> starts = new ArrayList<>();
        for (LocalDate start = firstStart; !start.isAfter(date); start = start.plusDays(WeeklyPeriod.LENGTH_DAYS)) {
            starts.add(start);
        }
        return starts;
    }
}
