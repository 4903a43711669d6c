package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.settings.OwnerSettings;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class SettingsResponse {

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("epoch_date")
    LocalDate epochDate;

    @JsonProperty("week_start_day")
    DayOfWeek weekStartDay;

    @JsonProperty("default_interest_rate")
    BigDecimal defaultInterestRate;

    public static SettingsResponse from(OwnerSettings settings) {
        return new SettingsResponse(settings.getOwnerId(), settings.getEpochDate(), settings.getWeekStartDay(),
            settings.getDefaultInterestRate());
    }
}
