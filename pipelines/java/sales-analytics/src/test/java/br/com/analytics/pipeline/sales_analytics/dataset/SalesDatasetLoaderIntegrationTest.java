package br.com.analytics.pipeline.sales_analytics.dataset;

import br.com.analytics.pipeline.sales_analytics.model.RejectionReason;
import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "analytics.dataset.location=classpath:fixtures/sales_fixture.csv"
)
@DisplayName("Sales dataset ingestion Tests")
class SalesDatasetLoaderIntegrationTest {

    @Autowired
    private SalesDatasetLoader datasetLoader;

    @Autowired
    private TransactionSnapshotHolder snapshotHolder;

    @Autowired
    private JobRepository jobRepository;

    @Test
    @DisplayName("Should load valid rows at startup, skip blank lines and count every rejected row by reason")
    void shouldLoadFixtureAtStartup() {
        TransactionSet snapshot = snapshotHolder.current();

        assertThat(snapshot.size()).isEqualTo(5);
        assertThat(snapshot.source()).isEqualTo("classpath:fixtures/sales_fixture.csv");
        assertThat(snapshot.rejectedCount()).isEqualTo(7L);
        assertThat(snapshot.rejections())
                .containsEntry(RejectionReason.NON_POSITIVE_QUANTITY, 1L)
                .containsEntry(RejectionReason.INVALID_DATE, 1L)
                .containsEntry(RejectionReason.DUPLICATE_TRANSACTION_ID, 1L)
                .containsEntry(RejectionReason.AGE_OUT_OF_RANGE, 1L)
                .containsEntry(RejectionReason.REVENUE_MISMATCH, 1L)
                .containsEntry(RejectionReason.RATING_OUT_OF_RANGE, 1L)
                .containsEntry(RejectionReason.MISSING_FIELD, 1L);

        TransactionRecord headphones = snapshot.records().get(1);
        assertThat(headphones.transactionId()).isEqualTo("TXN-1002");
        assertThat(headphones.quantity()).isEqualTo(2);
        assertThat(snapshot.records().get(2).customerRating()).isNull();
        assertThat(snapshot.latestPurchaseDate()).contains(LocalDate.of(2024, 3, 5));
    }

    @Test
    @DisplayName("Should publish a fresh snapshot on every reload")
    void shouldPublishFreshSnapshotOnReload() {
        // Given
        TransactionSet before = snapshotHolder.current();

        // When
        DatasetLoadReport first = datasetLoader.reload();
        TransactionSet afterFirst = snapshotHolder.current();
        DatasetLoadReport second = datasetLoader.reload();

        // Then
        TransactionSet afterSecond = snapshotHolder.current();
        assertThat(afterFirst).isNotSameAs(before);
        assertThat(afterSecond).isNotSameAs(afterFirst);
        assertThat(afterSecond.records()).isEqualTo(before.records());
        assertThat(first.recordsLoaded()).isEqualTo(5);
        assertThat(second.recordsLoaded()).isEqualTo(5);
        assertThat(second.recordsRejected()).isEqualTo(7L);
    }

    @Test
    @DisplayName("Should keep every load as its own job instance")
    void shouldRecordEachLoadAsSeparateJobInstance() {
        // Given
        long instancesBefore = jobRepository.getJobInstances("salesDatasetLoadJob", 0, Integer.MAX_VALUE).size();

        // When
        datasetLoader.reload();
        datasetLoader.reload();

        // Then
        assertThat(jobRepository.getJobInstances("salesDatasetLoadJob", 0, Integer.MAX_VALUE))
                .hasSize((int) instancesBefore + 2);
    }
}
