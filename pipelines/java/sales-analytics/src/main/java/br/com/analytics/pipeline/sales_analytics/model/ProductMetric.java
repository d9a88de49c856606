package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record ProductMetric(
        String productName,
        BigDecimal price,
        Long totalCount,
        @Nullable BigDecimal averageRating,
        BigDecimal totalRevenue,
        String category
) {
}
