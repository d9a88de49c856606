package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSet;
import br.com.analytics.pipeline.sales_analytics.model.AgeBucket;
import br.com.analytics.pipeline.sales_analytics.model.AgeGroupMetric;
import br.com.analytics.pipeline.sales_analytics.model.CategoryMetric;
import br.com.analytics.pipeline.sales_analytics.model.DatasetSummary;
import br.com.analytics.pipeline.sales_analytics.model.GroupStatistics;
import br.com.analytics.pipeline.sales_analytics.model.ProductMetric;
import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Group-then-reduce over a {@link TransactionSet}: one hash-map pass builds a reducer per key, then each group is
 * turned into its metric record. Groups without transactions never reach the output.
 */
public class Aggregator {

    /**
     * Reduces every group produced by {@code keySelector}. Keys keep the order of their first appearance; records
     * for which the selector yields no key are skipped.
     */
    public <K> Map<K, GroupStatistics> group(TransactionSet transactions,
                                             Function<TransactionRecord, Optional<K>> keySelector) {
        Map<K, GroupAccumulator> accumulators = new LinkedHashMap<>();
        for (TransactionRecord record : transactions.records()) {
            keySelector.apply(record).ifPresent(key ->
                    accumulators.computeIfAbsent(key, ignored -> new GroupAccumulator()).add(record));
        }

        Map<K, GroupStatistics> groups = new LinkedHashMap<>();
        accumulators.forEach((key, accumulator) -> {
            if (!accumulator.isEmpty()) {
                groups.put(key, accumulator.toStatistics());
            }
        });
        return groups;
    }

    public List<ProductMetric> byProduct(TransactionSet transactions) {
        Map<String, GroupStatistics> groups = group(transactions, record -> Optional.of(record.productName()));

        List<ProductMetric> products = new ArrayList<>(groups.size());
        groups.forEach((productName, statistics) -> products.add(new ProductMetric(
                productName,
                statistics.latestRecord().price(),
                statistics.totalUnits(),
                statistics.averageRating(),
                statistics.totalRevenue(),
                statistics.latestRecord().category()
        )));
        return products;
    }

    public List<CategoryMetric> byCategory(TransactionSet transactions) {
        Map<String, GroupStatistics> groups = group(transactions, record -> Optional.of(record.category()));
        BigDecimal grandTotal = grandTotal(groups);

        List<CategoryMetric> categories = new ArrayList<>(groups.size());
        groups.forEach((category, statistics) -> categories.add(new CategoryMetric(
                category,
                statistics.totalRevenue(),
                statistics.averageRevenuePerTransaction(),
                statistics.transactionCount(),
                statistics.averageRating(),
                statistics.totalUnits(),
                Percentages.share(statistics.totalRevenue(), grandTotal)
        )));
        return categories;
    }

    /**
     * Age groups in bucket order. Customer counts are transaction counts.
     */
    public List<AgeGroupMetric> byAgeGroup(TransactionSet transactions) {
        Map<AgeBucket, GroupStatistics> grouped = group(transactions, record -> AgeBucket.of(record.customerAge()));
        Map<AgeBucket, GroupStatistics> groups = new EnumMap<>(AgeBucket.class);
        groups.putAll(grouped);
        BigDecimal grandTotal = grandTotal(groups);

        List<AgeGroupMetric> ageGroups = new ArrayList<>(groups.size());
        groups.forEach((bucket, statistics) -> ageGroups.add(new AgeGroupMetric(
                bucket,
                statistics.transactionCount(),
                statistics.averageRevenuePerTransaction(),
                statistics.totalRevenue(),
                statistics.averageRating(),
                statistics.transactionCount(),
                Percentages.share(statistics.totalRevenue(), grandTotal)
        )));
        return ageGroups;
    }

    public DatasetSummary summarize(TransactionSet transactions) {
        GroupAccumulator overall = new GroupAccumulator();
        transactions.records().forEach(overall::add);

        int distinctProducts = (int) transactions.records().stream()
                .map(TransactionRecord::productName).distinct().count();
        int distinctCategories = (int) transactions.records().stream()
                .map(TransactionRecord::category).distinct().count();

        if (overall.isEmpty()) {
            return new DatasetSummary(0L, 0L, BigDecimal.ZERO, null, null, 0, 0);
        }
        GroupStatistics statistics = overall.toStatistics();
        return new DatasetSummary(
                statistics.transactionCount(),
                statistics.totalUnits(),
                statistics.totalRevenue(),
                statistics.averageRating(),
                statistics.averageRevenuePerTransaction(),
                distinctProducts,
                distinctCategories
        );
    }

    private static BigDecimal grandTotal(Map<?, GroupStatistics> groups) {
        return groups.values().stream()
                .map(GroupStatistics::totalRevenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
