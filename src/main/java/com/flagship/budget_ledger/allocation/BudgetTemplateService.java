package com.flagship.budget_ledger.allocation;

import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.exception.InvalidTemplateException;
import com.flagship.budget_ledger.exception.UnknownReferenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Owner-managed budget templates. The allocation engine only reads them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetTemplateService {

    private final BudgetTemplateRepository repository;
    private final AccountService accountService;

    /**
     * @throws InvalidTemplateException if the amounts do not fit the allocation type
     * @throws com.flagship.budget_ledger.exception.UnknownAccountException if the
     *         destination is not an active account of the owner
     */
    @Transactional
    public BudgetTemplate createTemplate(UUID ownerId, CreateTemplateCommand command) {
        BudgetTemplate template = BudgetTemplate.validated(
            UUID.randomUUID(),
            ownerId,
            command.getAccountId(),
            command.getAllocationType(),
            command.getFixedAmount(),
            command.getPercentage(),
            command.getMinAmount(),
            command.getMaxAmount(),
            command.getPriority() != null ? command.getPriority() : BudgetTemplate.DEFAULT_PRIORITY,
            true,
            command.getDescription(),
            null,
            null
        );
        accountService.requireActive(ownerId, command.getAccountId());

        BudgetTemplate saved = repository.saveAndFlush(BudgetTemplateEntity.fromDomain(template)).toDomain();
        log.info("Budget template created: ownerId={}, templateId={}, accountId={}, type={}, priority={}",
            ownerId, saved.getId(), saved.getAccountId(), saved.getAllocationType(), saved.getPriority());
        return saved;
    }

    @Transactional
    public BudgetTemplate updateTemplate(UUID ownerId, UUID templateId, UpdateTemplateCommand command) {
        BudgetTemplateEntity entity = requireEntity(ownerId, templateId);
        BudgetTemplate current = entity.toDomain();

        BudgetTemplate updated = BudgetTemplate.validated(
            current.getId(),
            ownerId,
            current.getAccountId(),
            command.getAllocationType() != null ? command.getAllocationType() : current.getAllocationType(),
            command.getFixedAmount(),
            command.getPercentage(),
            command.getMinAmount(),
            command.getMaxAmount(),
            command.getPriority() != null ? command.getPriority() : current.getPriority(),
            current.isActive(),
            command.getDescription() != null ? command.getDescription() : current.getDescription(),
            current.getSequenceNumber(),
            current.getCreatedAt()
        );
        entity.updateFromDomain(updated);

        log.info("Budget template updated: ownerId={}, templateId={}, type={}, priority={}",
            ownerId, templateId, updated.getAllocationType(), updated.getPriority());
        return updated;
    }

    @Transactional
    public BudgetTemplate deactivateTemplate(UUID ownerId, UUID templateId) {
        return setActive(ownerId, templateId, false);
    }

    @Transactional
    public BudgetTemplate activateTemplate(UUID ownerId, UUID templateId) {
        return setActive(ownerId, templateId, true);
    }

    @Transactional(readOnly = true)
    public BudgetTemplate getTemplate(UUID ownerId, UUID templateId) {
        return requireEntity(ownerId, templateId).toDomain();
    }

    /**
     * Templates in run order: priority ascending, then creation order.
     */
    @Transactional(readOnly = true)
    public List<BudgetTemplate> listTemplates(UUID ownerId, boolean activeOnly) {
        List<BudgetTemplateEntity> entities = activeOnly
            ? repository.findByOwnerIdAndActiveTrueOrderByPriorityAscCreatedAtAscSequenceNumberAsc(ownerId)
            : repository.findByOwnerIdOrderByPriorityAscCreatedAtAscSequenceNumberAsc(ownerId);
        return entities.stream().map(BudgetTemplateEntity::toDomain).toList();
    }

    private BudgetTemplate setActive(UUID ownerId, UUID templateId, boolean active) {
        BudgetTemplateEntity entity = requireEntity(ownerId, templateId);
        BudgetTemplate updated = entity.toDomain().withActive(active);
        entity.updateFromDomain(updated);
        log.info("Budget template {}: ownerId={}, templateId={}", active ? "activated" : "deactivated", ownerId, templateId);
        return updated;
    }

    private BudgetTemplateEntity requireEntity(UUID ownerId, UUID templateId) {
        return repository.findByIdAndOwnerId(templateId, ownerId)
            .orElseThrow(() -> UnknownReferenceException.of("Budget template", templateId));
    }
}
