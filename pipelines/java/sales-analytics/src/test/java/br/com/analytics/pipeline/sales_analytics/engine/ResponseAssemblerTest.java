package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.dataset.DatasetLoadReport;
import br.com.analytics.pipeline.sales_analytics.model.CategoryMetric;
import br.com.analytics.pipeline.sales_analytics.model.RejectionReason;
import br.com.analytics.pipeline.sales_analytics.payload.CategoriesResponse;
import br.com.analytics.pipeline.sales_analytics.payload.CategoryView;
import br.com.analytics.pipeline.sales_analytics.payload.DatasetStatusResponse;
import br.com.analytics.pipeline.sales_analytics.payload.ErrorResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResponseAssembler Tests")
class ResponseAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ResponseAssembler assembler = new ResponseAssembler(Clock.fixed(NOW, ZoneOffset.UTC));

    private static CategoryMetric category(String name, String revenue, String percentage) {
        return new CategoryMetric(name, new BigDecimal(revenue), new BigDecimal(revenue), 1L, null, 1L,
                new BigDecimal(percentage));
    }

    @Nested
    @DisplayName("Percentage apportionment")
    class ApportionTests {

        @Test
        @DisplayName("Should hand the missing tenth to the earliest of equal remainders")
        void shouldSplitThirds() {
            // Given
            List<BigDecimal> raw = List.of(
                    new BigDecimal("33.3333333333"),
                    new BigDecimal("33.3333333333"),
                    new BigDecimal("33.3333333333"));

            // When
            List<BigDecimal> rounded = ResponseAssembler.apportion(raw, Function.identity());

            // Then
            assertThat(rounded).containsExactly(
                    new BigDecimal("33.4"), new BigDecimal("33.3"), new BigDecimal("33.3"));
        }

        @Test
        @DisplayName("Should always total exactly one hundred")
        void shouldTotalOneHundred() {
            // Given
            List<BigDecimal> raw = List.of(
                    new BigDecimal("14.2857142857"),
                    new BigDecimal("28.5714285714"),
                    new BigDecimal("57.1428571429"));

            // When
            List<BigDecimal> rounded = ResponseAssembler.apportion(raw, Function.identity());

            // Then
            assertThat(rounded.stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualTo("100.0");
            assertThat(rounded).containsExactly(
                    new BigDecimal("14.3"), new BigDecimal("28.6"), new BigDecimal("57.1"));
        }

        @Test
        @DisplayName("Should keep a zero family at zero")
        void shouldKeepZeroFamily() {
            List<BigDecimal> rounded = ResponseAssembler.apportion(
                    List.of(BigDecimal.ZERO, BigDecimal.ZERO), Function.identity());

            assertThat(rounded).allSatisfy(value -> assertThat(value).isEqualByComparingTo("0"));
        }
    }

    @Test
    @DisplayName("Should round money half up to two decimals")
    void shouldRoundMoney() {
        assertThat(ResponseAssembler.money(new BigDecimal("10.005"))).isEqualTo("10.01");
        assertThat(ResponseAssembler.money(new BigDecimal("5775"))).isEqualTo("5775.00");
    }

    @Test
    @DisplayName("Should render categories with apportioned percentages")
    void shouldRenderCategories() {
        // When
        CategoriesResponse response = assembler.categories(List.of(
                category("Electronics", "200.004", "66.6666666667"),
                category("Books", "100.00", "33.3333333333")));

        // Then
        assertThat(response.totalCategories()).isEqualTo(2);
        CategoryView electronics = response.categories().get(0);
        assertThat(electronics.totalRevenue()).isEqualTo("200.00");
        assertThat(electronics.revenuePercentage()).isEqualTo("66.7");
        assertThat(electronics.avgRating()).isNull();
        assertThat(response.categories().get(1).revenuePercentage()).isEqualTo("33.3");
    }

    @Test
    @DisplayName("Should render an empty category list")
    void shouldRenderEmptyCategories() {
        CategoriesResponse response = assembler.categories(List.of());

        assertThat(response.categories()).isEmpty();
        assertThat(response.totalCategories()).isZero();
    }

    @Test
    @DisplayName("Should build the error envelope with the current UTC timestamp")
    void shouldBuildErrorEnvelope() {
        ErrorResponse error = assembler.error("No sales data available", 503);

        assertThat(error.detail()).isEqualTo("No sales data available");
        assertThat(error.statusCode()).isEqualTo(503);
        assertThat(error.timestamp()).isEqualTo("2024-05-01T12:00:00Z");
    }

    @Test
    @DisplayName("Should report rejection reasons in lower case")
    void shouldReportDatasetStatus() {
        // Given
        Map<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);
        rejections.put(RejectionReason.INVALID_DATE, 2L);
        DatasetLoadReport report = new DatasetLoadReport(40, 2L, rejections, "classpath:sales_data.csv", NOW);

        // When
        DatasetStatusResponse status = assembler.datasetStatus(report);

        // Then
        assertThat(status.recordsLoaded()).isEqualTo(40);
        assertThat(status.rejections()).containsEntry("invalid_date", 2L);
        assertThat(status.loadedAt()).isEqualTo("2024-05-01T12:00:00Z");
    }

    @Test
    @DisplayName("Should report health with the loaded record count")
    void shouldReportHealth() {
        assertThat(assembler.health(12))
                .satisfies(health -> {
                    assertThat(health.status()).isEqualTo("healthy");
                    assertThat(health.recordsLoaded()).isEqualTo(12);
                });
    }
}
