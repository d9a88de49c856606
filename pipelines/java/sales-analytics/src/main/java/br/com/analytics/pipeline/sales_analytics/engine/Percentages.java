package br.com.analytics.pipeline.sales_analytics.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Percentages {

    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final int SCALE = 10;

    private Percentages() {
    }

    /**
     * {@code 100 * part / whole}, or zero when {@code whole} is zero.
     */
    static BigDecimal share(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal mean(BigDecimal sum, long count) {
        return sum.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }
}
