package com.flagship.debt_settlement.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Shared tolerance and rounding rules for settlement amounts.
 *
 * Amounts are BigDecimal end to end, so sums are exact decimal arithmetic.
 * Rounding happens only when a settlement is emitted: two decimal places,
 * {@link RoundingMode#HALF_UP} (half away from zero).
 */
public final class MoneyRounding {

    /** One minor currency unit. Balances and transfers at or below this are treated as settled. */
    public static final BigDecimal EPSILON = new BigDecimal("0.01");

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private MoneyRounding() {
        // Utility class
    }

    public static BigDecimal round2(BigDecimal amount) {
        return amount.setScale(SCALE, ROUNDING);
    }

    /** {@code amount > EPSILON} */
    public static boolean exceedsEpsilon(BigDecimal amount) {
        return amount.compareTo(EPSILON) > 0;
    }

    /** {@code |amount| < EPSILON} */
    public static boolean isSettled(BigDecimal amount) {
        return amount.abs().compareTo(EPSILON) < 0;
    }

    /**
     * Converts an amount to whole minor units (cents), rounding with {@link #ROUNDING}.
     */
    public static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(SCALE, ROUNDING).unscaledValue().longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, SCALE);
    }
}
