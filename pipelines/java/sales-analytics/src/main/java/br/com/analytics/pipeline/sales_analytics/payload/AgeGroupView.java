package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record AgeGroupView(
        @JsonProperty("age_range") String ageRange,
        @JsonProperty("customer_count") Long customerCount,
        @JsonProperty("avg_spending") BigDecimal avgSpending,
        @JsonProperty("total_revenue") BigDecimal totalRevenue,
        @JsonProperty("avg_rating") @Nullable BigDecimal avgRating,
        @JsonProperty("transaction_count") Long transactionCount,
        @JsonProperty("revenue_percentage") BigDecimal revenuePercentage
) {
}
