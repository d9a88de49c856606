package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.YearMonth;

public record GrowthSummary(
        @Nullable BigDecimal overallGrowthRate,
        TrendDirection revenueTrend,
        @Nullable YearMonth bestPerformingMonth,
        String seasonalPattern
) {
}
