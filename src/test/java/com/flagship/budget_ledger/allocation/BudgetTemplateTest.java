package com.flagship.budget_ledger.allocation;

import com.flagship.budget_ledger.exception.InvalidTemplateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BudgetTemplateTest {

    private static BudgetTemplate build(AllocationType type, String fixed, String percentage, String min, String max) {
        return BudgetTemplate.validated(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), type,
            fixed != null ? new BigDecimal(fixed) : null,
            percentage != null ? new BigDecimal(percentage) : null,
            min != null ? new BigDecimal(min) : null,
            max != null ? new BigDecimal(max) : null,
            BudgetTemplate.DEFAULT_PRIORITY, true, null, null, null);
    }

    @Test
    @DisplayName("Fixed template requires a positive amount")
    void fixedRequiresPositiveAmount() {
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.FIXED, null, null, null, null));
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.FIXED, "0", null, null, null));
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.FIXED, "10.001", null, null, null));

        BudgetTemplate template = build(AllocationType.FIXED, "25", "40", null, null);
        assertEquals(new BigDecimal("25.00"), template.getFixedAmount());
        assertNull(template.getPercentage(), "Fields of other types are dropped");
    }

    @Test
    @DisplayName("Percentage must be in (0, 100]")
    void percentageBounds() {
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.PERCENTAGE, null, "0", null, null));
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.PERCENTAGE, null, "100.01", null, null));
        assertEquals(new BigDecimal("100"), build(AllocationType.PERCENTAGE, null, "100", null, null).getPercentage());
    }

    @Test
    @DisplayName("Range needs 0 <= min <= max and a positive max")
    void rangeBounds() {
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.RANGE, null, null, "60", "50"));
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.RANGE, null, null, "-1", "50"));
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.RANGE, null, null, "0", "0"));
        assertThrows(InvalidTemplateException.class, () -> build(AllocationType.RANGE, null, null, null, "10"));

        BudgetTemplate template = build(AllocationType.RANGE, null, null, "0", "50");
        assertEquals(new BigDecimal("0.00"), template.getMinAmount());
        assertEquals(new BigDecimal("50.00"), template.getMaxAmount());
    }
}
