package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CategoriesResponse(
        @JsonProperty("categories") List<CategoryView> categories,
        @JsonProperty("total_categories") Integer totalCategories
) {
}
