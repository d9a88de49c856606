package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;

public record DashboardResponse(
        @JsonProperty("period") Period period,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("monthly_trends") List<MonthlyTrendView> monthlyTrends,
        @JsonProperty("top_products") List<TopProductView> topProducts,
        @JsonProperty("category_breakdown") List<CategoryShareView> categoryBreakdown
) {

    public record Period(
            @JsonProperty("days") Integer days,
            @JsonProperty("start_date") String startDate,
            @JsonProperty("end_date") String endDate
    ) {
    }

    public record Summary(
            @JsonProperty("total_revenue") BigDecimal totalRevenue,
            @JsonProperty("total_transactions") Long totalTransactions,
            @JsonProperty("total_units_sold") Long totalUnitsSold,
            @JsonProperty("average_order_value") @Nullable BigDecimal averageOrderValue,
            @JsonProperty("average_rating") @Nullable BigDecimal averageRating,
            @JsonProperty("unique_products") Integer uniqueProducts,
            @JsonProperty("unique_categories") Integer uniqueCategories,
            @JsonProperty("overall_growth_rate") @Nullable BigDecimal overallGrowthRate,
            @JsonProperty("revenue_trend") String revenueTrend
    ) {
    }
}
