package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record CategoryMetric(
        String category,
        BigDecimal totalRevenue,
        BigDecimal avgRevenuePerTransaction,
        Long transactionCount,
        @Nullable BigDecimal avgRating,
        Long totalUnitsSold,
        BigDecimal revenuePercentage
) {
}
