package com.flagship.budget_ledger.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for {@code owner_settings}. Keyed by owner id; one row per owner at most.
 */
@Entity
@Table(name = "owner_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OwnerSettingsEntity {

    @Id
    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "epoch_date")
    private LocalDate epochDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "week_start_day", nullable = false, length = 10)
    private DayOfWeek weekStartDay;

    @Column(name = "default_interest_rate", nullable = false, precision = 9, scale = 6)
    private BigDecimal defaultInterestRate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static OwnerSettingsEntity fromDomain(OwnerSettings settings) {
        return new OwnerSettingsEntity(
            settings.getOwnerId(),
            settings.getEpochDate(),
            settings.getWeekStartDay(),
            settings.getDefaultInterestRate(),
            null,
            null
        );
    }

    OwnerSettings toDomain() {
        return new OwnerSettings(ownerId, epochDate, weekStartDay, defaultInterestRate);
    }

    void updateFromDomain(OwnerSettings settings) {
        this.epochDate = settings.getEpochDate();
        this.weekStartDay = settings.getWeekStartDay();
        this.defaultInterestRate = settings.getDefaultInterestRate();
    }
}
