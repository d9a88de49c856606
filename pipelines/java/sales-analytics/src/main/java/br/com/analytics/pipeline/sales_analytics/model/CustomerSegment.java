package br.com.analytics.pipeline.sales_analytics.model;

import java.math.BigDecimal;

/**
 * Per-segment figures. {@code customerCount} is the number of transactions falling in the segment.
 */
public record CustomerSegment(
        ValueSegment segment,
        Long customerCount,
        BigDecimal avgOrderValue,
        BigDecimal totalRevenue
) {
}
