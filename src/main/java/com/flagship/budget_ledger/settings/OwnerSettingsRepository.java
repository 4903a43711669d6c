package com.flagship.budget_ledger.settings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface OwnerSettingsRepository extends JpaRepository<OwnerSettingsEntity, UUID> {
}
