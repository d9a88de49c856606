package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.DatasetLoadReport;
import br.com.analytics.pipeline.sales_analytics.model.AgeGroupMetric;
import br.com.analytics.pipeline.sales_analytics.model.CategoryMetric;
import br.com.analytics.pipeline.sales_analytics.model.CustomerSegment;
import br.com.analytics.pipeline.sales_analytics.model.DatasetSummary;
import br.com.analytics.pipeline.sales_analytics.model.ForecastResult;
import br.com.analytics.pipeline.sales_analytics.model.GrowthSummary;
import br.com.analytics.pipeline.sales_analytics.model.MonthlyTrend;
import br.com.analytics.pipeline.sales_analytics.model.ProductMetric;
import br.com.analytics.pipeline.sales_analytics.model.RankedEntity;
import br.com.analytics.pipeline.sales_analytics.payload.AgeGroupView;
import br.com.analytics.pipeline.sales_analytics.payload.CategoriesResponse;
import br.com.analytics.pipeline.sales_analytics.payload.CategoryShareView;
import br.com.analytics.pipeline.sales_analytics.payload.CategoryView;
import br.com.analytics.pipeline.sales_analytics.payload.CustomerSegmentView;
import br.com.analytics.pipeline.sales_analytics.payload.DashboardResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DatasetStatusResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DemographicsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.ErrorResponse;
import br.com.analytics.pipeline.sales_analytics.payload.HealthResponse;
import br.com.analytics.pipeline.sales_analytics.payload.MonthlyTrendView;
import br.com.analytics.pipeline.sales_analytics.payload.ProductView;
import br.com.analytics.pipeline.sales_analytics.payload.ProductsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.RevenueInsightsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.TopProductView;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * Formats engine output into endpoint payloads: money to two decimals, percentages to one, dates as ISO strings.
 * Percentage families are apportioned so their rounded values still add up to exactly 100.
 */
public class ResponseAssembler {

    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 1;
    private static final long WHOLE_IN_TENTHS = 1000;
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ResponseAssembler(Clock clock) {
        this.clock = clock;
    }

    public ProductsResponse products(List<ProductMetric> products, DatasetSummary summary) {
        List<ProductView> views = products.stream()
                .map(product -> new ProductView(
                        product.productName(),
                        money(product.price()),
                        product.totalCount(),
                        rating(product.averageRating()),
                        money(product.totalRevenue()),
                        product.category()))
                .toList();
        return new ProductsResponse(views, views.size(), new ProductsResponse.Summary(
                money(summary.totalRevenue()),
                summary.totalUnits(),
                rating(summary.averageRating())));
    }

    public CategoriesResponse categories(List<CategoryMetric> categories) {
        List<BigDecimal> percentages = apportion(categories, CategoryMetric::revenuePercentage);
        List<CategoryView> views = IntStream.range(0, categories.size())
                .mapToObj(i -> {
                    CategoryMetric category = categories.get(i);
                    return new CategoryView(
                            category.category(),
                            money(category.totalRevenue()),
                            money(category.avgRevenuePerTransaction()),
                            category.transactionCount(),
                            rating(category.avgRating()),
                            category.totalUnitsSold(),
                            percentages.get(i));
                })
                .toList();
        return new CategoriesResponse(views, views.size());
    }

    public DemographicsResponse demographics(List<AgeGroupMetric> ageGroups, DatasetSummary summary,
                                             @Nullable AgeGroupMetric dominant) {
        List<BigDecimal> percentages = apportion(ageGroups, AgeGroupMetric::revenuePercentage);
        List<AgeGroupView> views = IntStream.range(0, ageGroups.size())
                .mapToObj(i -> {
                    AgeGroupMetric group = ageGroups.get(i);
                    return new AgeGroupView(
                            group.ageBucket().label(),
                            group.customerCount(),
                            money(group.avgSpending()),
                            money(group.totalRevenue()),
                            rating(group.avgRating()),
                            group.transactionCount(),
                            percentages.get(i));
                })
                .toList();
        return new DemographicsResponse(views, views.size(), new DemographicsResponse.Summary(
                summary.transactionCount(),
                money(summary.totalRevenue()),
                dominant == null ? null : dominant.ageBucket().label()));
    }

    public DashboardResponse dashboard(int days, LocalDate startDate, LocalDate endDate, DatasetSummary summary,
                                       List<MonthlyTrend> trends, GrowthSummary growth,
                                       List<RankedEntity> topProducts, List<CategoryMetric> categories) {
        DashboardResponse.Summary summaryView = new DashboardResponse.Summary(
                money(summary.totalRevenue()),
                summary.transactionCount(),
                summary.totalUnits(),
                summary.averageOrderValue() == null ? null : money(summary.averageOrderValue()),
                rating(summary.averageRating()),
                summary.distinctProducts(),
                summary.distinctCategories(),
                growth.overallGrowthRate(),
                growth.revenueTrend().label());
        return new DashboardResponse(
                new DashboardResponse.Period(days, startDate.toString(), endDate.toString()),
                summaryView,
                monthlyTrends(trends),
                topProducts(topProducts),
                categoryShares(categories));
    }

    public RevenueInsightsResponse revenueInsights(List<MonthlyTrend> trends, List<RankedEntity> topProducts,
                                                   List<CategoryMetric> categories, List<CustomerSegment> segments,
                                                   GrowthSummary growth, ForecastResult forecast) {
        List<CustomerSegmentView> segmentViews = segments.stream()
                .map(segment -> new CustomerSegmentView(
                        segment.segment().label(),
                        segment.customerCount(),
                        money(segment.avgOrderValue()),
                        money(segment.totalRevenue()),
                        segment.segment().criteria()))
                .toList();

        RevenueInsightsResponse.GrowthMetrics growthMetrics = new RevenueInsightsResponse.GrowthMetrics(
                growth.overallGrowthRate(),
                growth.revenueTrend().label(),
                growth.bestPerformingMonth() == null ? null : growth.bestPerformingMonth().toString(),
                growth.seasonalPattern());

        RevenueInsightsResponse.Forecasting forecasting = new RevenueInsightsResponse.Forecasting(
                money(forecast.predictedNextPeriodRevenue()),
                forecast.confidenceLevel().label(),
                forecast.keyDrivers());

        return new RevenueInsightsResponse(
                monthlyTrends(trends),
                topProducts(topProducts),
                categoryShares(categories),
                segmentViews,
                growthMetrics,
                forecasting);
    }

    public DatasetStatusResponse datasetStatus(DatasetLoadReport report) {
        Map<String, Long> rejections = new LinkedHashMap<>();
        report.rejections().forEach((reason, count) -> rejections.put(reason.name().toLowerCase(Locale.ROOT), count));
        return new DatasetStatusResponse(
                report.recordsLoaded(),
                report.recordsRejected(),
                rejections,
                report.source(),
                timestamp(report.loadedAt()));
    }

    public HealthResponse health(int recordsLoaded) {
        return new HealthResponse("healthy", timestamp(clock.instant()), recordsLoaded);
    }

    public ErrorResponse error(String detail, int statusCode) {
        return new ErrorResponse(detail, statusCode, timestamp(clock.instant()));
    }

    private List<MonthlyTrendView> monthlyTrends(List<MonthlyTrend> trends) {
        return trends.stream()
                .map(trend -> new MonthlyTrendView(
                        trend.month().toString(),
                        money(trend.revenue()),
                        trend.transactionCount(),
                        trend.growthRate()))
                .toList();
    }

    private List<TopProductView> topProducts(List<RankedEntity> ranked) {
        return ranked.stream()
                .map(entity -> new TopProductView(
                        entity.name(),
                        money(entity.totalRevenue()),
                        percent(entity.contributionPercentage()),
                        entity.rank()))
                .toList();
    }

    private List<CategoryShareView> categoryShares(List<CategoryMetric> categories) {
        List<BigDecimal> percentages = apportion(categories, CategoryMetric::revenuePercentage);
        return IntStream.range(0, categories.size())
                .mapToObj(i -> new CategoryShareView(
                        categories.get(i).category(),
                        money(categories.get(i).totalRevenue()),
                        percentages.get(i)))
                .toList();
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal percent(BigDecimal value) {
        return value.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    private static @Nullable BigDecimal rating(@Nullable BigDecimal value) {
        return value == null ? null : money(value);
    }

    private static String timestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    /**
     * Rounds a family of percentages to one decimal with the largest-remainder method: every value is floored to a
     * tenth, then the tenths still missing to reach 100.0 go to the largest remainders (earlier entries first on
     * ties). A family whose raw total is zero rounds to all zeros.
     * <p>
     * Entries with equal raw shares can therefore differ by a tenth: three equal categories come out as 33.4, 33.3
     * and 33.3. Rounding each share on its own would keep them equal but lets the family drift off 100.0 by up to
     * half a tenth per entry. Top-product contributions are not a complete family and are rounded individually.
     */
    static <T> List<BigDecimal> apportion(List<T> family, Function<T, BigDecimal> rawPercentage) {
        List<BigDecimal> raw = family.stream().map(rawPercentage).toList();
        BigDecimal total = raw.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() == 0) {
            return raw.stream().map(ResponseAssembler::percent).toList();
        }

        long[] tenths = new long[raw.size()];
        BigDecimal[] remainders = new BigDecimal[raw.size()];
        long allocated = 0;
        for (int i = 0; i < raw.size(); i++) {
            BigDecimal scaled = raw.get(i).movePointRight(1);
            BigDecimal floor = scaled.setScale(0, RoundingMode.FLOOR);
            tenths[i] = floor.longValueExact();
            remainders[i] = scaled.subtract(floor);
            allocated += tenths[i];
        }

        long missing = Math.max(0, Math.min(raw.size(), WHOLE_IN_TENTHS - allocated));
        List<Integer> byRemainder = new ArrayList<>(IntStream.range(0, raw.size()).boxed().toList());
        byRemainder.sort(Comparator.comparing((Integer i) -> remainders[i]).reversed()
                .thenComparing(Comparator.<Integer>naturalOrder()));
        for (int i = 0; i < missing; i++) {
            tenths[byRemainder.get(i)]++;
        }

        List<BigDecimal> apportioned = new ArrayList<>(raw.size());
        for (long value : tenths) {
            apportioned.add(BigDecimal.valueOf(value, PERCENT_SCALE));
        }
        return apportioned;
    }
}
