package com.flagship.budget_ledger.settings;

import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.exception.InvalidAmountException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Reads and updates per-owner settings.
 *
 * Owners without a stored row get the defaults: no epoch, the configured default week
 * start and a 2% per-period interest rate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnerSettingsService {

    private final OwnerSettingsRepository repository;
    private final LedgerProperties properties;

    @Transactional(readOnly = true)
    public OwnerSettings settingsFor(UUID ownerId) {
        return repository.findById(ownerId)
            .map(OwnerSettingsEntity::toDomain)
            .orElseGet(() -> OwnerSettings.defaults(ownerId, properties.getPeriods().getDefaultWeekStart()));
    }

    /**
     * Creates or updates the owner's settings.
     *
     * Changing the epoch or week start only affects how the first period is placed;
     * periods that already exist are never moved.
     *
     * @throws InvalidAmountException if the default interest rate is outside [0, 1]
     */
    @Transactional
    public OwnerSettings configure(UUID ownerId, ConfigureOwnerCommand command) {
        if (command.getDefaultInterestRate() != null) {
            validateRate(command.getDefaultInterestRate());
        }

        OwnerSettings current = settingsFor(ownerId);
        OwnerSettings updated = new OwnerSettings(
            ownerId,
            command.getEpochDate() != null ? command.getEpochDate() : current.getEpochDate(),
            command.getWeekStartDay() != null ? command.getWeekStartDay() : current.getWeekStartDay(),
            command.getDefaultInterestRate() != null ? command.getDefaultInterestRate() : current.getDefaultInterestRate()
        );

        OwnerSettingsEntity entity = repository.findById(ownerId)
            .map(existing -> {
                existing.updateFromDomain(updated);
                return existing;
            })
            .orElseGet(() -> OwnerSettingsEntity.fromDomain(updated));
        repository.save(entity);

        log.info("Owner settings updated: ownerId={}, epoch={}, weekStart={}, defaultRate={}",
            ownerId, updated.getEpochDate(), updated.getWeekStartDay(), updated.getDefaultInterestRate());
        return updated;
    }

    /**
     * Per-period interest rates must lie in [0, 1].
     */
    public static void validateRate(BigDecimal rate) {
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidAmountException("Interest rate must be between 0 and 1, got " + rate.toPlainString());
        }
    }
}
