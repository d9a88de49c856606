package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;

public record ProductsResponse(
        @JsonProperty("products") List<ProductView> products,
        @JsonProperty("total_products") Integer totalProducts,
        @JsonProperty("summary") Summary summary
) {

    public record Summary(
            @JsonProperty("total_revenue") BigDecimal totalRevenue,
            @JsonProperty("total_units_sold") Long totalUnitsSold,
            @JsonProperty("average_rating") @Nullable BigDecimal averageRating
    ) {
    }
}
