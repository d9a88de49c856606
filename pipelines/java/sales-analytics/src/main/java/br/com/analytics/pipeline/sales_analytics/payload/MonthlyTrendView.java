package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record MonthlyTrendView(
        @JsonProperty("month") String month,
        @JsonProperty("revenue") BigDecimal revenue,
        @JsonProperty("transaction_count") Long transactionCount,
        @JsonProperty("growth_rate") @Nullable BigDecimal growthRate
) {
}
