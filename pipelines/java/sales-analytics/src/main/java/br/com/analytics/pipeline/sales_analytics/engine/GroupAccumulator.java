package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.model.GroupStatistics;
import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;

import java.math.BigDecimal;

/**
 * Running sum/count/mean reducer for one group. Ratings are averaged over the records that carry one.
 */
final class GroupAccumulator {

    private long transactionCount;
    private long totalUnits;
    private BigDecimal totalRevenue = BigDecimal.ZERO;
    private BigDecimal ratingSum = BigDecimal.ZERO;
    private long ratingCount;
    private TransactionRecord latestRecord;

    void add(TransactionRecord record) {
        transactionCount++;
        totalUnits += record.quantity();
        totalRevenue = totalRevenue.add(record.revenue());
        record.rating().ifPresent(rating -> {
            ratingSum = ratingSum.add(rating);
            ratingCount++;
        });
        if (latestRecord == null || !record.purchaseDate().isBefore(latestRecord.purchaseDate())) {
            latestRecord = record;
        }
    }

    boolean isEmpty() {
        return transactionCount == 0;
    }

    GroupStatistics toStatistics() {
        BigDecimal averageRating = ratingCount == 0 ? null : Percentages.mean(ratingSum, ratingCount);
        return new GroupStatistics(
                transactionCount,
                totalUnits,
                totalRevenue,
                Percentages.mean(totalRevenue, transactionCount),
                averageRating,
                latestRecord
        );
    }
}
