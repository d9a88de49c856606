package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSet;
import br.com.analytics.pipeline.sales_analytics.model.CustomerSegment;
import br.com.analytics.pipeline.sales_analytics.model.GroupStatistics;
import br.com.analytics.pipeline.sales_analytics.model.ValueSegment;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns every transaction, on its own revenue, to a value segment. Both thresholds belong to the medium segment.
 */
public class Segmenter {

    static final BigDecimal HIGH_VALUE_THRESHOLD = BigDecimal.valueOf(200);
    static final BigDecimal LOW_VALUE_THRESHOLD = BigDecimal.valueOf(50);

    private final Aggregator aggregator;

    public Segmenter(Aggregator aggregator) {
        this.aggregator = aggregator;
    }

    public ValueSegment classify(BigDecimal revenue) {
        if (revenue.compareTo(HIGH_VALUE_THRESHOLD) > 0) {
            return ValueSegment.HIGH;
        }
        if (revenue.compareTo(LOW_VALUE_THRESHOLD) >= 0) {
            return ValueSegment.MEDIUM;
        }
        return ValueSegment.LOW;
    }

    /**
     * All three segments, high to low, including empty ones.
     */
    public List<CustomerSegment> segment(TransactionSet transactions) {
        Map<ValueSegment, GroupStatistics> groups =
                aggregator.group(transactions, record -> Optional.of(classify(record.revenue())));

        List<CustomerSegment> segments = new ArrayList<>(ValueSegment.values().length);
        for (ValueSegment segment : ValueSegment.values()) {
            GroupStatistics statistics = groups.get(segment);
            if (statistics == null) {
                segments.add(new CustomerSegment(segment, 0L, BigDecimal.ZERO, BigDecimal.ZERO));
            } else {
                segments.add(new CustomerSegment(
                        segment,
                        statistics.transactionCount(),
                        statistics.averageRevenuePerTransaction(),
                        statistics.totalRevenue()
                ));
            }
        }
        return segments;
    }
}
