package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSet;
import br.com.analytics.pipeline.sales_analytics.model.GroupStatistics;
import br.com.analytics.pipeline.sales_analytics.model.GrowthSummary;
import br.com.analytics.pipeline.sales_analytics.model.MonthlyTrend;
import br.com.analytics.pipeline.sales_analytics.model.TrendDirection;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Calendar-month trend of revenue and transaction counts, with month-over-month growth.
 */
public class TrendAnalyzer {

    private static final BigDecimal SLIGHT_CHANGE_LIMIT = BigDecimal.TEN;

    private final Aggregator aggregator;
    private final BigDecimal stableBand;

    public TrendAnalyzer(Aggregator aggregator, BigDecimal stableBand) {
        this.aggregator = aggregator;
        this.stableBand = stableBand.abs();
    }

    /**
     * One entry per month present in the data, oldest first.
     */
    public List<MonthlyTrend> monthlyTrends(TransactionSet transactions) {
        Map<YearMonth, GroupStatistics> months = new TreeMap<>(
                aggregator.group(transactions, record -> Optional.of(record.purchaseMonth())));

        List<MonthlyTrend> trends = new ArrayList<>(months.size());
        BigDecimal previousRevenue = null;
        for (Map.Entry<YearMonth, GroupStatistics> month : months.entrySet()) {
            BigDecimal revenue = month.getValue().totalRevenue();
            trends.add(new MonthlyTrend(
                    month.getKey(),
                    revenue,
                    month.getValue().transactionCount(),
                    growthRate(previousRevenue, revenue).orElse(null)
            ));
            previousRevenue = revenue;
        }
        return trends;
    }

    /**
     * Percent change from {@code previous} to {@code current}, one decimal. Empty without a previous period or when
     * the previous period had no revenue.
     */
    public static Optional<BigDecimal> growthRate(@Nullable BigDecimal previous, BigDecimal current) {
        if (previous == null || previous.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(current.subtract(previous)
                .multiply(Percentages.HUNDRED)
                .divide(previous, 1, RoundingMode.HALF_UP));
    }

    /**
     * Growth between the two most recent months.
     */
    public Optional<BigDecimal> overallGrowthRate(List<MonthlyTrend> trends) {
        if (trends.size() < 2) {
            return Optional.empty();
        }
        return trends.get(trends.size() - 1).growth();
    }

    public TrendDirection classify(Optional<BigDecimal> growthRate) {
        if (growthRate.isEmpty()) {
            return TrendDirection.INSUFFICIENT_DATA;
        }
        BigDecimal rate = growthRate.get();
        if (rate.abs().compareTo(stableBand) <= 0) {
            return TrendDirection.STABLE;
        }
        return rate.signum() > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    public GrowthSummary growthSummary(List<MonthlyTrend> trends) {
        Optional<BigDecimal> overall = overallGrowthRate(trends);
        Optional<YearMonth> bestMonth = trends.stream()
                .max(Comparator.comparing(MonthlyTrend::revenue)
                        .thenComparing(MonthlyTrend::month, Comparator.reverseOrder()))
                .map(MonthlyTrend::month);

        return new GrowthSummary(
                overall.orElse(null),
                classify(overall),
                bestMonth.orElse(null),
                seasonalPattern(trends, overall)
        );
    }

    private String seasonalPattern(List<MonthlyTrend> trends, Optional<BigDecimal> overall) {
        TrendDirection direction = classify(overall);
        if (direction == TrendDirection.INSUFFICIENT_DATA) {
            return direction.label();
        }
        YearMonth latest = trends.get(trends.size() - 1).month();
        String monthName = latest.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
        if (direction == TrendDirection.STABLE) {
            return "stable_in_" + monthName;
        }

        BigDecimal rate = overall.get();
        String movement = rate.signum() > 0 ? "growth" : "decline";
        String prefix = rate.abs().compareTo(SLIGHT_CHANGE_LIMIT) < 0 ? "slight_" : "";
        return prefix + movement + "_in_" + monthName;
    }
}
