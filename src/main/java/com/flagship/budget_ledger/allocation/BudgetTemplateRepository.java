package com.flagship.budget_ledger.allocation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetTemplateRepository extends JpaRepository<BudgetTemplateEntity, UUID> {

    Optional<BudgetTemplateEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<BudgetTemplateEntity> findByOwnerIdOrderByPriorityAscCreatedAtAscSequenceNumberAsc(UUID ownerId);

    List<BudgetTemplateEntity> findByOwnerIdAndActiveTrueOrderByPriorityAscCreatedAtAscSequenceNumberAsc(UUID ownerId);
}
