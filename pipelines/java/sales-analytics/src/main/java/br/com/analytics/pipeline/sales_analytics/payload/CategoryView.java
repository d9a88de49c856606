package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record CategoryView(
        @JsonProperty("category") String category,
        @JsonProperty("total_revenue") BigDecimal totalRevenue,
        @JsonProperty("avg_revenue_per_transaction") BigDecimal avgRevenuePerTransaction,
        @JsonProperty("transaction_count") Long transactionCount,
        @JsonProperty("avg_rating") @Nullable BigDecimal avgRating,
        @JsonProperty("total_units_sold") Long totalUnitsSold,
        @JsonProperty("revenue_percentage") BigDecimal revenuePercentage
) {
}
