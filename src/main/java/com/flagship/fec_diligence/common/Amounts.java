package com.flagship.fec_diligence.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

/**
 * Arithmetic helpers shared by the statement engines.
 *
 * Amounts are BigDecimal throughout. Ratios never throw on a zero denominator:
 * they degrade to zero (or null where the caller needs "undefined").
 */
public final class Amounts {

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    public static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);
    public static final BigDecimal CENT = new BigDecimal("0.01");

    private static final int RATIO_SCALE = 4;

    private Amounts() {
        // Utility class
    }

    public static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amount) {
        return items.stream()
            .map(amount)
            .map(Amounts::nullToZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * numerator / denominator * multiplier, or zero when the denominator is zero.
     */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator, BigDecimal multiplier) {
        BigDecimal result = ratioOrNull(numerator, denominator, multiplier);
        return result != null ? result : BigDecimal.ZERO;
    }

    /**
     * numerator / denominator * multiplier, or null when the denominator is zero.
     */
    public static BigDecimal ratioOrNull(BigDecimal numerator, BigDecimal denominator, BigDecimal multiplier) {
        if (denominator == null || denominator.signum() == 0) {
            return null;
        }
        return nullToZero(numerator)
            .multiply(multiplier)
            .divide(denominator, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentOf(BigDecimal amount, BigDecimal base) {
        return ratio(amount, base, HUNDRED);
    }

    /**
     * True when |value| is strictly greater than the threshold.
     */
    public static boolean exceeds(BigDecimal value, BigDecimal threshold) {
        return value.abs().compareTo(threshold) > 0;
    }

    /**
     * True when |a - b| is strictly below the tolerance.
     */
    public static boolean withinTolerance(BigDecimal a, BigDecimal b, BigDecimal tolerance) {
        return a.subtract(b).abs().compareTo(tolerance) < 0;
    }
}
