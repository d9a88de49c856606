package br.com.analytics.pipeline.sales_analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.util.List;

@ConfigurationProperties(prefix = "analytics")
public record AnalyticsProperties(
        @DefaultValue Dataset dataset,
        @DefaultValue Ranking ranking,
        @DefaultValue Trend trend,
        @DefaultValue Forecast forecast
) {

    /**
     * @param location Spring resource location of the sales CSV
     * @param columns  column order of the CSV file; the header line is skipped
     */
    public record Dataset(
            @DefaultValue("classpath:sales_data.csv") String location,
            @DefaultValue({"transaction_id", "product_name", "category", "price", "quantity", "revenue",
                    "customer_age", "purchase_date", "customer_rating"}) List<String> columns,
            @DefaultValue("500") int chunkSize,
            @DefaultValue("true") boolean loadOnStartup
    ) {
    }

    public record Ranking(
            @DefaultValue("2") int insightsTopProducts,
            @DefaultValue("5") int dashboardTopProducts
    ) {

        public Ranking {
            if (insightsTopProducts < 1 || dashboardTopProducts < 1) {
                throw new IllegalArgumentException("analytics.ranking top-product counts must be at least 1 but were "
                        + insightsTopProducts + " and " + dashboardTopProducts);
            }
        }
    }

    /**
     * @param stableBand growth rates within plus or minus this many percent classify as stable
     */
    public record Trend(
            @DefaultValue("2.0") BigDecimal stableBand
    ) {
    }

    /**
     * @param windowMonths          number of most recent months the forecast averages
     * @param growthFactor          multiplier applied to the averaged revenue
     * @param stableThreshold       growth-rate standard deviation (percentage points) at or below which a full
     *                              window earns high confidence
     * @param volatileThreshold     standard deviation above which confidence drops to low
     * @param keyDriverCategories   number of top categories named as key drivers
     */
    public record Forecast(
            @DefaultValue("3") int windowMonths,
            @DefaultValue("1.05") BigDecimal growthFactor,
            @DefaultValue("10.0") double stableThreshold,
            @DefaultValue("25.0") double volatileThreshold,
            @DefaultValue("1") int keyDriverCategories
    ) {
    }
}
