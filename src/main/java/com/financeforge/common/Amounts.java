package com.financeforge.common;

import com.financeforge.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal arithmetic helpers for ledger amounts.
 * All balances and event amounts are held at two decimal places using BigDecimal.
 */
public final class Amounts {

    public static final int SCALE = 2;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Amounts() {
    }

    /**
     * Rounds a computed value (savings, allocations) to ledger scale.
     */
    public static BigDecimal round(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Normalizes a caller-supplied amount. Amounts with more than two decimal
     * places are rejected rather than silently rounded.
     */
    public static BigDecimal of(BigDecimal value) {
        if (value == null) {
            throw new ValidationException("Amount cannot be null");
        }
        if (value.stripTrailingZeros().scale() > SCALE) {
            throw new ValidationException(
                String.format("Amount %s has more than %d decimal places", value.toPlainString(), SCALE));
        }
        return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal of(String value) {
        return of(new BigDecimal(value));
    }

    public static boolean isPositive(BigDecimal value) {
        return value.signum() > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value.signum() < 0;
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * True when the two amounts differ by no more than epsilon.
     */
    public static boolean withinEpsilon(BigDecimal a, BigDecimal b, BigDecimal epsilon) {
        return a.subtract(b).abs().compareTo(epsilon) <= 0;
    }
}
