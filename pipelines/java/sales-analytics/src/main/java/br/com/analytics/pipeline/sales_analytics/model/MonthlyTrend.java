package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Optional;

/**
 * @param growthRate percent change against the previous month, one decimal; absent for the first month
 *                   and after a month without revenue
 */
public record MonthlyTrend(
        YearMonth month,
        BigDecimal revenue,
        Long transactionCount,
        @Nullable BigDecimal growthRate
) {

    public Optional<BigDecimal> growth() {
        return Optional.ofNullable(growthRate);
    }
}
