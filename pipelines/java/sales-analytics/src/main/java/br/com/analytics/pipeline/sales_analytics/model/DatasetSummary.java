package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record DatasetSummary(
        Long transactionCount,
        Long totalUnits,
        BigDecimal totalRevenue,
        @Nullable BigDecimal averageRating,
        @Nullable BigDecimal averageOrderValue,
        Integer distinctProducts,
        Integer distinctCategories
) {
}
