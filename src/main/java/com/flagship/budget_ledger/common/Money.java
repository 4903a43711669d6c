package com.flagship.budget_ledger.common;

import com.flagship.budget_ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point money helpers.
 *
 * All amounts carry scale 2. Inputs with more precision are rejected rather than
 * silently rounded; derived amounts (percentages, interest) are rounded half-even.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {
    }

    /**
     * Validates an input amount and returns it at scale 2.
     *
     * @throws InvalidAmountException if the amount is null or has more than two decimals
     */
    public static BigDecimal of(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new InvalidAmountException(
                String.format("Amount %s has more than %d decimal places", amount.toPlainString(), SCALE));
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    /**
     * Validates that an amount is strictly positive.
     */
    public static BigDecimal positive(BigDecimal amount, String label) {
        BigDecimal value = of(amount);
        if (value.signum() <= 0) {
            throw new InvalidAmountException(label + " must be greater than zero, got " + value.toPlainString());
        }
        return value;
    }

    /**
     * Rounds a derived amount to scale 2.
     */
    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }

    /**
     * {@code percentage} percent of {@code base}, rounded.
     */
    public static BigDecimal percentOf(BigDecimal base, BigDecimal percentage) {
        return round(base.multiply(percentage).divide(HUNDRED));
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isZero(BigDecimal amount) {
        return amount.signum() == 0;
    }
}
