package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record TopProductView(
        @JsonProperty("product_name") String productName,
        @JsonProperty("total_revenue") BigDecimal totalRevenue,
        @JsonProperty("revenue_contribution") BigDecimal revenueContribution,
        @JsonProperty("rank") Integer rank
) {
}
