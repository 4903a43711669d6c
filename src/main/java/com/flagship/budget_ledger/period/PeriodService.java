package com.flagship.budget_ledger.period;

import com.flagship.budget_ledger.common.OwnerLock;
import com.flagship.budget_ledger.common.PagedSequence;
import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.exception.PeriodGapException;
import com.flagship.budget_ledger.exception.UnknownReferenceException;
import com.flagship.budget_ledger.settings.OwnerSettings;
import com.flagship.budget_ledger.settings.OwnerSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves and generates an owner's weekly periods.
 *
 * Periods partition time from the first one onward: each period starts where the
 * previous one ends. Gap filling only ever appends after the latest period, under the
 * owner lock, so concurrent callers cannot create overlapping or duplicate weeks
 * (the unique (owner_id, start_date) constraint backs this up).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodService {

    private static final String SELECT_PERIOD =
        "SELECT id, owner_id, start_date, end_date FROM weekly_periods ";

    private final JdbcTemplate jdbcTemplate;
    private final OwnerLock ownerLock;
    private final OwnerSettingsService settingsService;
    private final LedgerProperties properties;

    /**
     * Returns the period containing {@code today}, creating it and any missing
     * periods before it.
     *
     * The first period starts on the owner's epoch aligned back to the configured week
     * start day. The epoch is the configured one, or else the creation date of the
     * owner's earliest account.
     *
     * @throws PeriodGapException if the owner has no epoch, or {@code today} precedes
     *         the first period
     */
    @Transactional
    public WeeklyPeriod currentPeriod(UUID ownerId, LocalDate today) {
        Optional<WeeklyPeriod> existing = periodContaining(ownerId, today);
        if (existing.isPresent()) {
            return existing.get();
        }

        ownerLock.acquire(ownerId);
        existing = periodContaining(ownerId, today);
        if (existing.isPresent()) {
            return existing.get();
        }

        Optional<WeeklyPeriod> first = firstPeriod(ownerId);
        LocalDate nextStart;
        if (first.isPresent()) {
            if (today.isBefore(first.get().getStartDate())) {
                throw new PeriodGapException(String.format(
                    "Date %s precedes the first period starting %s", today, first.get().getStartDate()));
            }
            nextStart = latestPeriod(ownerId).orElseThrow().getEndDate();
        } else {
            OwnerSettings settings = settingsService.settingsFor(ownerId);
            LocalDate epoch = Optional.ofNullable(settings.getEpochDate())
                .or(() -> earliestAccountDate(ownerId))
                .orElseThrow(() -> new PeriodGapException(
                    "Owner " + ownerId + " has no epoch date and no accounts to derive one from"));
            nextStart = PeriodCalendar.alignToWeekStart(epoch, settings.getWeekStartDay());
            if (today.isBefore(nextStart)) {
                throw new PeriodGapException(String.format(
                    "Date %s precedes the first period starting %s", today, nextStart));
            }
        }

        List<LocalDate> starts = PeriodCalendar.startsThrough(nextStart, today);
        WeeklyPeriod created = null;
        for (LocalDate start : starts) {
            created = WeeklyPeriod.starting(ownerId, start);
            jdbcTemplate.update(
                "INSERT INTO weekly_periods (id, owner_id, start_date, end_date) VALUES (?, ?, ?, ?)",
                created.getId(), ownerId, created.getStartDate(), created.getEndDate());
        }

        log.info("Weekly periods generated: ownerId={}, count={}, from={}, through={}",
            ownerId, starts.size(), nextStart, created.getEndDate());
        return created;
    }

    /**
     * Periods overlapping {@code [from, to]}, oldest first.
     *
     * Nothing is read until the result is iterated, and every iteration starts over
     * with fresh pages.
     */
    public Iterable<WeeklyPeriod> periodsInRange(UUID ownerId, LocalDate from, LocalDate to) {
        int pageSize = properties.getHistory().getPageSize();
        return new PagedSequence<>(after -> after == null
            ? jdbcTemplate.query(
                SELECT_PERIOD + "WHERE owner_id = ? AND end_date > ? AND start_date <= ? ORDER BY start_date LIMIT ?",
                periodRowMapper(), ownerId, from, to, pageSize)
            : jdbcTemplate.query(
                SELECT_PERIOD + "WHERE owner_id = ? AND end_date > ? AND start_date <= ? AND start_date > ? " +
                "ORDER BY start_date LIMIT ?",
                periodRowMapper(), ownerId, from, to, after.getStartDate(), pageSize),
            pageSize);
    }

    /**
     * @throws UnknownReferenceException if the period does not exist in the owner's scope
     */
    @Transactional(readOnly = true)
    public WeeklyPeriod getPeriod(UUID ownerId, UUID periodId) {
        return findPeriod(ownerId, periodId)
            .orElseThrow(() -> UnknownReferenceException.of("Period", periodId));
    }

    @Transactional(readOnly = true)
    public Optional<WeeklyPeriod> findPeriod(UUID ownerId, UUID periodId) {
        return jdbcTemplate.query(SELECT_PERIOD + "WHERE id = ? AND owner_id = ?",
            periodRowMapper(), periodId, ownerId).stream().findFirst();
    }

    /**
     * Existing period containing the date. Never creates one.
     */
    @Transactional(readOnly = true)
    public Optional<WeeklyPeriod> periodContaining(UUID ownerId, LocalDate date) {
        return jdbcTemplate.query(
            SELECT_PERIOD + "WHERE owner_id = ? AND start_date <= ? AND end_date > ?",
            periodRowMapper(), ownerId, date, date).stream().findFirst();
    }

    private Optional<WeeklyPeriod> firstPeriod(UUID ownerId) {
        return jdbcTemplate.query(SELECT_PERIOD + "WHERE owner_id = ? ORDER BY start_date LIMIT 1",
            periodRowMapper(), ownerId).stream().findFirst();
    }

    private Optional<WeeklyPeriod> latestPeriod(UUID ownerId) {
        return jdbcTemplate.query(SELECT_PERIOD + "WHERE owner_id = ? ORDER BY start_date DESC LIMIT 1",
            periodRowMapper(), ownerId).stream().findFirst();
    }

    private Optional<LocalDate> earliestAccountDate(UUID ownerId) {
        Timestamp earliest = jdbcTemplate.queryForObject(
            "SELECT MIN(created_at) FROM accounts WHERE owner_id = ?", Timestamp.class, ownerId);
        return Optional.ofNullable(earliest)
            .map(timestamp -> LocalDate.ofInstant(timestamp.toInstant(), ZoneOffset.UTC));
    }

    static RowMapper<WeeklyPeriod> periodRowMapper() {
        return (rs, rowNum) -> new WeeklyPeriod(
            rs.getObject("id", UUID.class),
            rs.getObject("owner_id", UUID.class),
            rs.getObject("start_date", LocalDate.class),
            rs.getObject("end_date", LocalDate.class)
        );
    }
}
