package com.flagship.budget_ledger.allocation;

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
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for budget templates.
 *
 * No setters: state changes go through {@link #updateFromDomain} with an already
 * validated {@link BudgetTemplate}. Owner and destination account never change.
 */
@Entity
@Table(name = "budget_templates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BudgetTemplateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_type", nullable = false, length = 20)
    private AllocationType allocationType;

    @Column(name = "fixed_amount", precision = 19, scale = 2)
    private BigDecimal fixedAmount;

    @Column(name = "percentage", precision = 5, scale = 2)
    private BigDecimal percentage;

    @Column(name = "min_amount", precision = 19, scale = 2)
    private BigDecimal minAmount;

    @Column(name = "max_amount", precision = 19, scale = 2)
    private BigDecimal maxAmount;

    @Column(nullable = false)
    private int priority;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(length = 255)
    private String description;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

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

    static BudgetTemplateEntity fromDomain(BudgetTemplate template) {
        return new BudgetTemplateEntity(
            template.getId(),
            template.getOwnerId(),
            template.getAccountId(),
            template.getAllocationType(),
            template.getFixedAmount(),
            template.getPercentage(),
            template.getMinAmount(),
            template.getMaxAmount(),
            template.getPriority(),
            template.isActive(),
            template.getDescription(),
            null, // sequenceNumber assigned by the database
            null, // createdAt set by @PrePersist
            null  // updatedAt set by @PrePersist
        );
    }

    BudgetTemplate toDomain() {
        return new BudgetTemplate(id, ownerId, accountId, allocationType, fixedAmount, percentage,
            minAmount, maxAmount, priority, active, description, sequenceNumber, createdAt);
    }

    void updateFromDomain(BudgetTemplate template) {
        this.allocationType = template.getAllocationType();
        this.fixedAmount = template.getFixedAmount();
        this.percentage = template.getPercentage();
        this.minAmount = template.getMinAmount();
        this.maxAmount = template.getMaxAmount();
        this.priority = template.getPriority();
        this.active = template.isActive();
        this.description = template.getDescription();
    }
}
