package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record CategoryShareView(
        @JsonProperty("category") String category,
        @JsonProperty("revenue") BigDecimal revenue,
        @JsonProperty("percentage") BigDecimal percentage
) {
}
