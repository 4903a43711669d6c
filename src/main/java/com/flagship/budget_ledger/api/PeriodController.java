package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.api.dto.PeriodResponse;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.period.PeriodService;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/owners/{ownerId}/periods")
@RequiredArgsConstructor
public class PeriodController {

    private final PeriodService periodService;

    /**
     * The period containing {@code date} (today in UTC by default). Missing periods up
     * to that date are created.
     */
    @GetMapping("/current")
    public ResponseEntity<PeriodResponse> currentPeriod(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        CorrelationContext.bindOwner(ownerId);
        LocalDate today = date != null ? date : LocalDate.now(ZoneOffset.UTC);
        return ResponseEntity.ok(PeriodResponse.from(periodService.currentPeriod(ownerId, today)));
    }

    @GetMapping
    public ResponseEntity<List<PeriodResponse>> listPeriods(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        List<PeriodResponse> periods = new ArrayList<>();
        for (WeeklyPeriod period : periodService.periodsInRange(ownerId, from, to)) {
            periods.add(PeriodResponse.from(period));
        }
        return ResponseEntity.ok(periods);
    }

    @GetMapping("/{periodId}")
    public ResponseEntity<PeriodResponse> getPeriod(@PathVariable("ownerId") UUID ownerId,
                                                    @PathVariable("periodId") UUID periodId) {
        return ResponseEntity.ok(PeriodResponse.from(periodService.getPeriod(ownerId, periodId)));
    }
}
