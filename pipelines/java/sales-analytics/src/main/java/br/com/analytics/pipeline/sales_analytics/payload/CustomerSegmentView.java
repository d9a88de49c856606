package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record CustomerSegmentView(
        @JsonProperty("segment") String segment,
        @JsonProperty("customer_count") Long customerCount,
        @JsonProperty("avg_order_value") BigDecimal avgOrderValue,
        @JsonProperty("total_revenue") BigDecimal totalRevenue,
        @JsonProperty("criteria") String criteria
) {
}
