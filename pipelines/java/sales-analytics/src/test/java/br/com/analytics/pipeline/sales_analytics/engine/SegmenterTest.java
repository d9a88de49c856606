package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSet;
import br.com.analytics.pipeline.sales_analytics.model.CustomerSegment;
import br.com.analytics.pipeline.sales_analytics.model.ValueSegment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static br.com.analytics.pipeline.sales_analytics.TestTransactions.sale;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Segmenter Tests")
class SegmenterTest {

    private final Segmenter segmenter = new Segmenter(new Aggregator());

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "200.01, HIGH",
            "200.00, MEDIUM",
            "120.00, MEDIUM",
            "50.00, MEDIUM",
            "49.99, LOW",
            "0.50, LOW"
    })
    @DisplayName("Should keep both thresholds in the medium segment")
    void shouldClassifyAtBoundaries(String revenue, ValueSegment expected) {
        assertThat(segmenter.classify(new BigDecimal(revenue))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should aggregate transactions per segment")
    void shouldAggregateSegments() {
        // Given
        TransactionSet transactions = TransactionSet.of(List.of(
                sale("300.00", "2024-01-01"),
                sale("500.00", "2024-01-02"),
                sale("75.00", "2024-01-03"),
                sale("10.00", "2024-01-04"),
                sale("20.00", "2024-01-05")
        ));

        // When
        List<CustomerSegment> segments = segmenter.segment(transactions);

        // Then
        assertThat(segments).extracting(CustomerSegment::segment)
                .containsExactly(ValueSegment.HIGH, ValueSegment.MEDIUM, ValueSegment.LOW);
        CustomerSegment high = segments.get(0);
        assertThat(high.customerCount()).isEqualTo(2L);
        assertThat(high.totalRevenue()).isEqualByComparingTo("800.00");
        assertThat(high.avgOrderValue()).isEqualByComparingTo("400.00");
        assertThat(segments.get(2).avgOrderValue()).isEqualByComparingTo("15.00");
    }

    @Test
    @DisplayName("Should emit empty segments with zero values")
    void shouldEmitEmptySegments() {
        // Given
        TransactionSet transactions = TransactionSet.of(List.of(sale("75.00", "2024-01-03")));

        // When
        List<CustomerSegment> segments = segmenter.segment(transactions);

        // Then
        assertThat(segments).hasSize(3);
        assertThat(segments.get(0).customerCount()).isZero();
        assertThat(segments.get(0).avgOrderValue()).isEqualByComparingTo("0");
        assertThat(segments.get(1).customerCount()).isEqualTo(1L);
        assertThat(segments.get(2).totalRevenue()).isEqualByComparingTo("0");
    }
}
