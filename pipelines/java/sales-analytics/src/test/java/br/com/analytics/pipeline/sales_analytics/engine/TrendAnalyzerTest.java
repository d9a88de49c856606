package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.TransactionSet;
import br.com.analytics.pipeline.sales_analytics.model.GrowthSummary;
import br.com.analytics.pipeline.sales_analytics.model.MonthlyTrend;
import br.com.analytics.pipeline.sales_analytics.model.TrendDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import static br.com.analytics.pipeline.sales_analytics.TestTransactions.sale;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrendAnalyzer Tests")
class TrendAnalyzerTest {

    private final TrendAnalyzer trendAnalyzer = new TrendAnalyzer(new Aggregator(), new BigDecimal("2.0"));

    @Nested
    @DisplayName("Monthly trends")
    class MonthlyTrendTests {

        @Test
        @DisplayName("Should compute month-over-month growth in chronological order")
        void shouldComputeGrowthRates() {
            // Given
            TransactionSet transactions = TransactionSet.of(List.of(
                    sale("120.00", "2024-03-14"),
                    sale("60.00", "2024-01-02"),
                    sale("150.00", "2024-02-20"),
                    sale("40.00", "2024-01-31")
            ));

            // When
            List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(transactions);

            // Then
            assertThat(trends).extracting(MonthlyTrend::month)
                    .containsExactly(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3));
            assertThat(trends.get(0).revenue()).isEqualByComparingTo("100.00");
            assertThat(trends.get(0).transactionCount()).isEqualTo(2L);
            assertThat(trends.get(0).growthRate()).isNull();
            assertThat(trends.get(1).growthRate()).isEqualByComparingTo("50.0");
            assertThat(trends.get(2).growthRate()).isEqualByComparingTo("-20.0");
        }

        @Test
        @DisplayName("Should skip months without transactions")
        void shouldSkipEmptyMonths() {
            // Given
            TransactionSet transactions = TransactionSet.of(List.of(
                    sale("100.00", "2024-01-10"),
                    sale("110.00", "2024-04-10")
            ));

            // When
            List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(transactions);

            // Then
            assertThat(trends).hasSize(2);
            assertThat(trends.get(1).month()).isEqualTo(YearMonth.of(2024, 4));
            assertThat(trends.get(1).growthRate()).isEqualByComparingTo("10.0");
        }

        @Test
        @DisplayName("Should return no trend for an empty dataset")
        void shouldReturnNothingForEmptyDataset() {
            assertThat(trendAnalyzer.monthlyTrends(TransactionSet.empty())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Growth rate")
    class GrowthRateTests {

        @Test
        @DisplayName("Should be absent when the previous period had no revenue")
        void shouldBeAbsentAfterZeroRevenue() {
            assertThat(TrendAnalyzer.growthRate(BigDecimal.ZERO, new BigDecimal("80.00"))).isEmpty();
        }

        @Test
        @DisplayName("Should be absent without a previous period")
        void shouldBeAbsentWithoutPrevious() {
            assertThat(TrendAnalyzer.growthRate(null, new BigDecimal("80.00"))).isEmpty();
        }

        @Test
        @DisplayName("Should round to one decimal half up")
        void shouldRoundHalfUp() {
            // 1/3 more than the previous period
            assertThat(TrendAnalyzer.growthRate(new BigDecimal("300"), new BigDecimal("400")))
                    .hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("33.3"));
            assertThat(TrendAnalyzer.growthRate(new BigDecimal("2000"), new BigDecimal("2001")))
                    .hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("0.1"));
        }
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2.1, INCREASING",
            "2.0, STABLE",
            "0.0, STABLE",
            "-2.0, STABLE",
            "-2.1, DECREASING",
            "-35.5, DECREASING"
    })
    @DisplayName("Should classify growth against the stable band")
    void shouldClassifyGrowth(String rate, TrendDirection expected) {
        assertThat(trendAnalyzer.classify(Optional.of(new BigDecimal(rate)))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should classify a missing growth rate as insufficient data")
    void shouldClassifyMissingGrowth() {
        assertThat(trendAnalyzer.classify(Optional.empty())).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
    }

    @Nested
    @DisplayName("Growth summary")
    class GrowthSummaryTests {

        @Test
        @DisplayName("Should report the latest growth, best month and seasonal pattern")
        void shouldSummarizeGrowth() {
            // Given
            List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(TransactionSet.of(List.of(
                    sale("100.00", "2024-01-10"),
                    sale("150.00", "2024-02-10"),
                    sale("120.00", "2024-03-10")
            )));

            // When
            GrowthSummary summary = trendAnalyzer.growthSummary(trends);

            // Then
            assertThat(summary.overallGrowthRate()).isEqualByComparingTo("-20.0");
            assertThat(summary.revenueTrend()).isEqualTo(TrendDirection.DECREASING);
            assertThat(summary.bestPerformingMonth()).isEqualTo(YearMonth.of(2024, 2));
            assertThat(summary.seasonalPattern()).isEqualTo("decline_in_march");
        }

        @Test
        @DisplayName("Should mark small movements as slight")
        void shouldMarkSlightGrowth() {
            // Given
            List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(TransactionSet.of(List.of(
                    sale("100.00", "2024-05-10"),
                    sale("105.00", "2024-06-10")
            )));

            // When
            GrowthSummary summary = trendAnalyzer.growthSummary(trends);

            // Then
            assertThat(summary.revenueTrend()).isEqualTo(TrendDirection.INCREASING);
            assertThat(summary.seasonalPattern()).isEqualTo("slight_growth_in_june");
        }

        @Test
        @DisplayName("Should prefer the earliest month when revenues tie")
        void shouldPreferEarliestBestMonth() {
            // Given
            List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(TransactionSet.of(List.of(
                    sale("200.00", "2024-01-10"),
                    sale("100.00", "2024-02-10"),
                    sale("200.00", "2024-03-10")
            )));

            // When / Then
            assertThat(trendAnalyzer.growthSummary(trends).bestPerformingMonth()).isEqualTo(YearMonth.of(2024, 1));
        }

        @Test
        @DisplayName("Should report insufficient data for a single month")
        void shouldReportInsufficientData() {
            // Given
            List<MonthlyTrend> trends = trendAnalyzer.monthlyTrends(TransactionSet.of(List.of(
                    sale("100.00", "2024-01-10"))));

            // When
            GrowthSummary summary = trendAnalyzer.growthSummary(trends);

            // Then
            assertThat(summary.overallGrowthRate()).isNull();
            assertThat(summary.revenueTrend()).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
            assertThat(summary.bestPerformingMonth()).isEqualTo(YearMonth.of(2024, 1));
            assertThat(summary.seasonalPattern()).isEqualTo("insufficient_data");
        }
    }
}
