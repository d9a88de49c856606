package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

public record ProductView(
        @JsonProperty("product_name") String productName,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("total_count") Long totalCount,
        @JsonProperty("average_rating") @Nullable BigDecimal averageRating,
        @JsonProperty("total_revenue") BigDecimal totalRevenue,
        @JsonProperty("category") String category
) {
}
