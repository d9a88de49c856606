package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;

public record RevenueInsightsResponse(
        @JsonProperty("monthly_trends") List<MonthlyTrendView> monthlyTrends,
        @JsonProperty("top_products") List<TopProductView> topProducts,
        @JsonProperty("category_distribution") List<CategoryShareView> categoryDistribution,
        @JsonProperty("customer_segments") List<CustomerSegmentView> customerSegments,
        @JsonProperty("growth_metrics") GrowthMetrics growthMetrics,
        @JsonProperty("forecasting") Forecasting forecasting
) {

    public record GrowthMetrics(
            @JsonProperty("overall_growth_rate") @Nullable BigDecimal overallGrowthRate,
            @JsonProperty("revenue_trend") String revenueTrend,
            @JsonProperty("best_performing_month") @Nullable String bestPerformingMonth,
            @JsonProperty("seasonal_pattern") String seasonalPattern
    ) {
    }

    public record Forecasting(
            @JsonProperty("predicted_next_month_revenue") BigDecimal predictedNextMonthRevenue,
            @JsonProperty("confidence_level") String confidenceLevel,
            @JsonProperty("key_drivers") List<String> keyDrivers
    ) {
    }
}
