package com.flagship.budget_ledger.common;

import com.flagship.budget_ledger.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Inputs are normalized to two decimals, extra precision is rejected")
    void ofNormalizesScale() {
        assertEquals(new BigDecimal("12.30"), Money.of("12.3"));
        assertEquals(new BigDecimal("5.00"), Money.of("5.000"));
        assertThrows(InvalidAmountException.class, () -> Money.of("0.001"));
        assertThrows(InvalidAmountException.class, () -> Money.of((BigDecimal) null));
    }

    @Test
    @DisplayName("Positive rejects zero and negatives")
    void positive() {
        assertEquals(new BigDecimal("0.01"), Money.positive(new BigDecimal("0.01"), "Amount"));
        assertThrows(InvalidAmountException.class, () -> Money.positive(BigDecimal.ZERO, "Amount"));
        assertThrows(InvalidAmountException.class, () -> Money.positive(new BigDecimal("-3"), "Amount"));
    }

    @Test
    @DisplayName("Percentages round half-even")
    void percentOf() {
        assertEquals(new BigDecimal("60.00"), Money.percentOf(new BigDecimal("200.00"), new BigDecimal("30")));
        assertEquals(new BigDecimal("0.02"), Money.percentOf(new BigDecimal("0.25"), new BigDecimal("10")));
        assertEquals(new BigDecimal("0.04"), Money.percentOf(new BigDecimal("0.35"), new BigDecimal("10")));
        assertEquals(new BigDecimal("33.35"), Money.percentOf(new BigDecimal("100.05"), new BigDecimal("33.33")));
    }
}
