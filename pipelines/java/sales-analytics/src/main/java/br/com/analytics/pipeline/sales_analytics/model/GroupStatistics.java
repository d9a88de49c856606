package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

/**
 * Reduced figures of one group of transactions. Values are unrounded.
 *
 * @param latestRecord the most recent record of the group, later rows winning on equal dates
 */
public record GroupStatistics(
        Long transactionCount,
        Long totalUnits,
        BigDecimal totalRevenue,
        BigDecimal averageRevenuePerTransaction,
        @Nullable BigDecimal averageRating,
        TransactionRecord latestRecord
) {
}
