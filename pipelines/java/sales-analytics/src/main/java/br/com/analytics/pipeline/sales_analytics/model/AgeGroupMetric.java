package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

/**
 * Metrics of one age bucket. {@code customerCount} counts transactions: the dataset carries no customer identity.
 */
public record AgeGroupMetric(
        AgeBucket ageBucket,
        Long customerCount,
        BigDecimal avgSpending,
        BigDecimal totalRevenue,
        @Nullable BigDecimal avgRating,
        Long transactionCount,
        BigDecimal revenuePercentage
) {
}
