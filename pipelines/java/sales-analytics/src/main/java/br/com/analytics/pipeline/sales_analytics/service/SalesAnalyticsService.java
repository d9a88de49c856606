package br.com.analytics.pipeline.sales_analytics.service;

import br.com.analytics.pipeline.sales_analytics.config.AnalyticsProperties;
import br.com.analytics.pipeline.sales_analytics.dataset.DatasetLoadReport;
import br.com.analytics.pipeline.sales_analytics.dataset.SalesDatasetLoader;
import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSet;
import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSnapshotHolder;
import br.com.analytics.pipeline.sales_analytics.engine.Aggregator;
import br.com.analytics.pipeline.sales_analytics.engine.ForecastEstimator;
import br.com.analytics.pipeline.sales_analytics.engine.RankingEngine;
import br.com.analytics.pipeline.sales_analytics.engine.ResponseAssembler;
import br.com.analytics.pipeline.sales_analytics.engine.Segmenter;
import br.com.analytics.pipeline.sales_analytics.engine.TrendAnalyzer;
import br.com.analytics.pipeline.sales_analytics.exception.InvalidParameterException;
import br.com.analytics.pipeline.sales_analytics.exception.NoDataAvailableException;
import br.com.analytics.pipeline.sales_analytics.model.AgeGroupMetric;
import br.com.analytics.pipeline.sales_analytics.model.CategoryMetric;
import br.com.analytics.pipeline.sales_analytics.model.ForecastResult;
import br.com.analytics.pipeline.sales_analytics.model.GrowthSummary;
import br.com.analytics.pipeline.sales_analytics.model.MonthlyTrend;
import br.com.analytics.pipeline.sales_analytics.model.ProductMetric;
import br.com.analytics.pipeline.sales_analytics.model.RankedEntity;
import br.com.analytics.pipeline.sales_analytics.payload.CategoriesResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DashboardResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DatasetStatusResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DemographicsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.HealthResponse;
import br.com.analytics.pipeline.sales_analytics.payload.ProductsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.RevenueInsightsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Runs the analytics engine for each endpoint. Every call reads the published snapshot once and computes over that
 * snapshot only.
 */
@Service
public class SalesAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(SalesAnalyticsService.class);

    static final int MIN_DASHBOARD_DAYS = 1;
    static final int MAX_DASHBOARD_DAYS = 180;

    private final TransactionSnapshotHolder snapshotHolder;
    private final SalesDatasetLoader datasetLoader;
    private final Aggregator aggregator;
    private final TrendAnalyzer trendAnalyzer;
    private final Segmenter segmenter;
    private final RankingEngine rankingEngine;
    private final ForecastEstimator forecastEstimator;
    private final ResponseAssembler assembler;
    private final int insightsTopProducts;
    private final int dashboardTopProducts;

    public SalesAnalyticsService(
            TransactionSnapshotHolder snapshotHolder,
            SalesDatasetLoader datasetLoader,
            Aggregator aggregator,
            TrendAnalyzer trendAnalyzer,
            Segmenter segmenter,
            RankingEngine rankingEngine,
            ForecastEstimator forecastEstimator,
            ResponseAssembler assembler,
            AnalyticsProperties properties) {
        this.snapshotHolder = snapshotHolder;
        this.datasetLoader = datasetLoader;
        this.aggregator = aggregator;
        this.trendAnalyzer = trendAnalyzer;
        this.segmenter = segmenter;
        this.rankingEngine = rankingEngine;
        this.forecastEstimator = forecastEstimator;
        this.assembler = assembler;
        this.insightsTopProducts = properties.ranking().insightsTopProducts();
        this.dashboardTopProducts = properties.ranking().dashboardTopProducts();
    }

    public ProductsResponse products() {
        TransactionSet transactions = snapshotHolder.current();
        return assembler.products(aggregator.byProduct(transactions), aggregator.summarize(transactions));
    }

    public CategoriesResponse categories() {
        TransactionSet transactions = snapshotHolder.current();
        return assembler.categories(rankedCategories(transactions));
    }

    public DemographicsResponse demographics() {
        TransactionSet transactions = snapshotHolder.current();
        List<AgeGroupMetric> ageGroups = aggregator.byAgeGroup(transactions);
        AgeGroupMetric dominant = rankingEngine
                .order(ageGroups, group -> group.ageBucket().label(), AgeGroupMetric::totalRevenue)
                .stream()
                .findFirst()
                .orElse(null);
        return assembler.demographics(ageGroups, aggregator.summarize(transactions), dominant);
    }

    /**
     * Dashboard over the last {@code days} calendar days, counted back from the most recent purchase in the data.
     */
    public DashboardResponse dashboard(int days) {
        if (days < MIN_DASHBOARD_DAYS || days > MAX_DASHBOARD_DAYS) {
            throw new InvalidParameterException("days", "days must be between " + MIN_DASHBOARD_DAYS
                    + " and " + MAX_DASHBOARD_DAYS + " but was " + days);
        }
        TransactionSet transactions = requireData();

        LocalDate endDate = transactions.latestPurchaseDate().orElseThrow(NoDataAvailableException::new);
        LocalDate startDate = endDate.minusDays(days - 1L);
        TransactionSet window = transactions.between(startDate, endDate);
        log.debug("Computing dashboard for {} to {} ({} transactions)", startDate, endDate, window.size());

        List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(window);
        List<RankedEntity> topProducts = rankingEngine.top(aggregator.byProduct(window),
                ProductMetric::productName, ProductMetric::totalRevenue, dashboardTopProducts);

        return assembler.dashboard(
                days,
                startDate,
                endDate,
                aggregator.summarize(window),
                trends,
                trendAnalyzer.growthSummary(trends),
                topProducts,
                rankedCategories(window));
    }

    public RevenueInsightsResponse revenueInsights() {
        TransactionSet transactions = requireData();

        List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(transactions);
        GrowthSummary growth = trendAnalyzer.growthSummary(trends);
        List<CategoryMetric> categories = rankedCategories(transactions);
        List<RankedEntity> topProducts = rankingEngine.top(aggregator.byProduct(transactions),
                ProductMetric::productName, ProductMetric::totalRevenue, insightsTopProducts);
        List<RankedEntity> categoryRanking = rankingEngine.top(categories,
                CategoryMetric::category, CategoryMetric::totalRevenue, Math.max(1, categories.size()));
        ForecastResult forecast = forecastEstimator.estimate(trends, categoryRanking);

        return assembler.revenueInsights(
                trends,
                topProducts,
                categories,
                segmenter.segment(transactions),
                growth,
                forecast);
    }

    public DatasetStatusResponse datasetStatus() {
        return assembler.datasetStatus(DatasetLoadReport.of(snapshotHolder.current()));
    }

    public DatasetStatusResponse reloadDataset() {
        return assembler.datasetStatus(datasetLoader.reload());
    }

    public HealthResponse health() {
        return assembler.health(snapshotHolder.current().size());
    }

    private List<CategoryMetric> rankedCategories(TransactionSet transactions) {
        return rankingEngine.order(aggregator.byCategory(transactions),
                CategoryMetric::category, CategoryMetric::totalRevenue);
    }

    private TransactionSet requireData() {
        TransactionSet transactions = snapshotHolder.current();
        if (transactions.isEmpty()) {
            throw new NoDataAvailableException();
        }
        return transactions;
    }
}
