package com.flagship.budget_ledger.allocation;

import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.exception.InvalidAmountException;
import com.flagship.budget_ledger.exception.InvalidTemplateException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;

/**
 * A standing instruction to fund an account from each period's pool.
 *
 * Only the amount fields of its own type are set. Templates run by ascending priority,
 * ties broken by creation order.
 */
@Value
public class BudgetTemplate {
    public static final int DEFAULT_PRIORITY = 3;

    public static final Comparator<BudgetTemplate> RUN_ORDER = Comparator
        .comparingInt(BudgetTemplate::getPriority)
        .thenComparing(BudgetTemplate::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(BudgetTemplate::getSequenceNumber, Comparator.nullsLast(Comparator.naturalOrder()));

    UUID id;
    UUID ownerId;
    UUID accountId;
    AllocationType allocationType;
    BigDecimal fixedAmount;
    BigDecimal percentage;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    int priority;
    boolean active;
    String description;
    Long sequenceNumber;
    Instant createdAt;

    /**
     * Checks that the amounts fit the allocation type and returns a template carrying
     * only those amounts, normalized to money scale.
     *
     * @throws InvalidTemplateException if a required amount is missing or out of range
     */
    public static BudgetTemplate validated(UUID id, UUID ownerId, UUID accountId, AllocationType type,
                                           BigDecimal fixedAmount, BigDecimal percentage,
                                           BigDecimal minAmount, BigDecimal maxAmount,
                                           int priority, boolean active, String description,
                                           Long sequenceNumber, Instant createdAt) {
        if (type == null) {
            throw new InvalidTemplateException("Allocation type is required");
        }
        if (priority < 0) {
            throw new InvalidTemplateException("Priority cannot be negative");
        }
        return switch (type) {
            case FIXED -> {
                BigDecimal fixed = amount(fixedAmount, "Fixed amount");
                if (fixed.signum() <= 0) {
                    throw new InvalidTemplateException("Fixed amount must be greater than zero");
                }
                yield new BudgetTemplate(id, ownerId, accountId, type, fixed, null, null, null,
                    priority, active, description, sequenceNumber, createdAt);
            }
            case PERCENTAGE -> {
                if (percentage == null) {
                    throw new InvalidTemplateException("Percentage is required");
                }
                if (percentage.signum() <= 0 || percentage.compareTo(new BigDecimal("100")) > 0) {
                    throw new InvalidTemplateException(
                        "Percentage must be greater than 0 and at most 100, got " + percentage.toPlainString());
                }
                if (percentage.stripTrailingZeros().scale() > 2) {
                    throw new InvalidTemplateException("Percentage allows at most two decimal places");
                }
                yield new BudgetTemplate(id, ownerId, accountId, type, null, percentage, null, null,
                    priority, active, description, sequenceNumber, createdAt);
            }
            case RANGE -> {
                BigDecimal min = amount(minAmount, "Minimum amount");
                BigDecimal max = amount(maxAmount, "Maximum amount");
                if (min.signum() < 0) {
                    throw new InvalidTemplateException("Minimum amount cannot be negative");
                }
                if (max.signum() <= 0) {
                    throw new InvalidTemplateException("Maximum amount must be greater than zero");
                }
                if (min.compareTo(max) > 0) {
                    throw new InvalidTemplateException(String.format(
                        "Minimum amount %s exceeds maximum amount %s", min.toPlainString(), max.toPlainString()));
                }
                yield new BudgetTemplate(id, ownerId, accountId, type, null, null, min, max,
                    priority, active, description, sequenceNumber, createdAt);
            }
        };
    }

    public BudgetTemplate withActive(boolean active) {
        return new BudgetTemplate(id, ownerId, accountId, allocationType, fixedAmount, percentage,
            minAmount, maxAmount, priority, active, description, sequenceNumber, createdAt);
    }

    private static BigDecimal amount(BigDecimal value, String label) {
        if (value == null) {
            throw new InvalidTemplateException(label + " is required");
        }
        try {
            return Money.of(value);
        } catch (InvalidAmountException e) {
            throw new InvalidTemplateException(label + ": " + e.getMessage());
        }
    }
}
