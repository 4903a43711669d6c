package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * end_date is exclusive.
 */
@Value
public class PeriodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    public static PeriodResponse from(WeeklyPeriod period) {
        return new PeriodResponse(period.getId(), period.getStartDate(), period.getEndDate());
    }
}
