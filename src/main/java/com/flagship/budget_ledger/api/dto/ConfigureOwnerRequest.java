package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.settings.ConfigureOwnerCommand;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;

@Value
public class ConfigureOwnerRequest {

    @JsonProperty("epoch_date")
    LocalDate epochDate;

    @JsonProperty("week_start_day")
    DayOfWeek weekStartDay;

    @JsonProperty("default_interest_rate")
    BigDecimal defaultInterestRate;

    public ConfigureOwnerCommand toCommand() {
        return ConfigureOwnerCommand.builder()
            .epochDate(epochDate)
            .weekStartDay(weekStartDay)
            .defaultInterestRate(defaultInterestRate)
            .build();
    }
}
