package com.pulseboard.customer.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Ratios {

    private Ratios() {
    }

    /**
     * Rounds the exact binary value of {@code value} half-to-even, so 300.125 becomes 300.12
     * and 2.675 (stored as 2.67499...) becomes 2.67. NaN and infinities become 0.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** {@code part / total * 100} to one decimal, or 0 when {@code total} is 0. */
    public static double percent(long part, long total) {
        if (total == 0) {
            return 0;
        }
        return round(part * 100.0 / total, 1);
    }

    public static double average(double sum, long count, int scale) {
        if (count == 0) {
            return 0;
        }
        return round(sum / count, scale);
    }
}
