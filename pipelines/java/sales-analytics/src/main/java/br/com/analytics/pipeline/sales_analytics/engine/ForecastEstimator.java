package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.model.ConfidenceLevel;
import br.com.analytics.pipeline.sales_analytics.model.ForecastResult;
import br.com.analytics.pipeline.sales_analytics.model.MonthlyTrend;
import br.com.analytics.pipeline.sales_analytics.model.RankedEntity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Next-month revenue heuristic: the mean of the most recent months scaled by a flat growth factor. Confidence
 * follows the spread of the recent growth rates. This is not a fitted model.
 */
public class ForecastEstimator {

    static final String RETENTION_DRIVER = "customer_retention";
    static final String REACTIVATION_DRIVER = "customer_reactivation";

    private final int windowMonths;
    private final BigDecimal growthFactor;
    private final double stableThreshold;
    private final double volatileThreshold;
    private final int keyDriverCategories;

    public ForecastEstimator(int windowMonths, BigDecimal growthFactor, double stableThreshold,
                             double volatileThreshold, int keyDriverCategories) {
        if (windowMonths < 1) {
            throw new IllegalArgumentException("forecast window must be at least one month but was " + windowMonths);
        }
        this.windowMonths = windowMonths;
        this.growthFactor = growthFactor;
        this.stableThreshold = stableThreshold;
        this.volatileThreshold = volatileThreshold;
        this.keyDriverCategories = keyDriverCategories;
    }

    /**
     * @param trends           monthly trend, oldest first
     * @param rankedCategories categories ordered by revenue, highest first
     */
    public ForecastResult estimate(List<MonthlyTrend> trends, List<RankedEntity> rankedCategories) {
        List<MonthlyTrend> window = trends.subList(Math.max(0, trends.size() - windowMonths), trends.size());
        return new ForecastResult(
                predict(window),
                confidence(trends.size(), window),
                keyDrivers(trends, rankedCategories)
        );
    }

    private BigDecimal predict(List<MonthlyTrend> window) {
        if (window.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = window.stream()
                .map(MonthlyTrend::revenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Percentages.mean(sum, window.size()).multiply(growthFactor);
    }

    ConfidenceLevel confidence(int availableMonths, List<MonthlyTrend> window) {
        if (availableMonths < 2) {
            return ConfidenceLevel.LOW;
        }
        List<Double> growthRates = window.stream()
                .map(MonthlyTrend::growth)
                .flatMap(Optional::stream)
                .map(BigDecimal::doubleValue)
                .toList();
        if (growthRates.isEmpty()) {
            return ConfidenceLevel.LOW;
        }

        double volatility = standardDeviation(growthRates);
        if (volatility > volatileThreshold) {
            return ConfidenceLevel.LOW;
        }
        if (availableMonths >= windowMonths && growthRates.size() >= 2 && volatility <= stableThreshold) {
            return ConfidenceLevel.HIGH;
        }
        return ConfidenceLevel.MEDIUM;
    }

    private List<String> keyDrivers(List<MonthlyTrend> trends, List<RankedEntity> rankedCategories) {
        List<String> drivers = new ArrayList<>();
        rankedCategories.stream()
                .limit(keyDriverCategories)
                .map(category -> slug(category.name()) + "_sales")
                .forEach(drivers::add);

        boolean declining = !trends.isEmpty()
                && trends.get(trends.size() - 1).growth().map(rate -> rate.signum() < 0).orElse(false);
        drivers.add(declining ? REACTIVATION_DRIVER : RETENTION_DRIVER);
        return drivers;
    }

    private static double standardDeviation(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = values.stream()
                .mapToDouble(value -> (value - mean) * (value - mean))
                .average()
                .orElse(0);
        return Math.sqrt(variance);
    }

    private static String slug(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return slug.replaceAll("^_+|_+$", "");
    }
}
