package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;

public record DemographicsResponse(
        @JsonProperty("age_groups") List<AgeGroupView> ageGroups,
        @JsonProperty("total_age_groups") Integer totalAgeGroups,
        @JsonProperty("summary") Summary summary
) {

    public record Summary(
            @JsonProperty("total_customers") Long totalCustomers,
            @JsonProperty("total_revenue") BigDecimal totalRevenue,
            @JsonProperty("dominant_age_group") @Nullable String dominantAgeGroup
    ) {
    }
}
