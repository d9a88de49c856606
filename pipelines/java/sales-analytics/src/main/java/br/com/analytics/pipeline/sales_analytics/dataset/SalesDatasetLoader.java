package br.com.analytics.pipeline.sales_analytics.dataset;

import br.com.analytics.pipeline.sales_analytics.config.AnalyticsProperties;
import br.com.analytics.pipeline.sales_analytics.exception.DatasetLoadException;
import br.com.analytics.pipeline.sales_analytics.processor.TransactionValidationProcessor;
import br.com.analytics.pipeline.sales_analytics.writer.TransactionSetWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the ingestion job and publishes its output as the new {@link TransactionSet}. Loads are serialized; when a
 * load fails the previously published snapshot stays in place.
 */
@Service
public class SalesDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(SalesDatasetLoader.class);

    private final JobOperator jobOperator;
    private final Job salesDatasetLoadJob;
    private final TransactionValidationProcessor processor;
    private final TransactionSetWriter writer;
    private final TransactionSnapshotHolder snapshotHolder;
    private final Clock clock;
    private final String location;
    private final AtomicLong runSequence = new AtomicLong();

    public SalesDatasetLoader(
            JobOperator jobOperator,
            Job salesDatasetLoadJob,
            TransactionValidationProcessor processor,
            TransactionSetWriter writer,
            TransactionSnapshotHolder snapshotHolder,
            Clock clock,
            AnalyticsProperties properties) {
        this.jobOperator = jobOperator;
        this.salesDatasetLoadJob = salesDatasetLoadJob;
        this.processor = processor;
        this.writer = writer;
        this.snapshotHolder = snapshotHolder;
        this.clock = clock;
        this.location = properties.dataset().location();
    }

    public synchronized DatasetLoadReport reload() {
        log.info("Loading sales data from {}", location);
        processor.reset();
        writer.reset();

        Instant startedAt = clock.instant();
        JobParameters parameters = new JobParametersBuilder()
                .addString("dataset.location", location)
                .addString("requested.at", startedAt.toString())
                .addLong("run.id", runSequence.incrementAndGet())
                .toJobParameters();

        JobExecution execution;
        try {
            execution = jobOperator.start(salesDatasetLoadJob, parameters);
        } catch (Exception e) {
            throw new DatasetLoadException("Unable to start sales data load from " + location, e);
        }

        if (execution.getStatus() != BatchStatus.COMPLETED) {
            List<Throwable> failures = execution.getAllFailureExceptions();
            String message = "Error loading sales data from " + location + ": job ended with status "
                    + execution.getStatus();
            if (failures.isEmpty()) {
                throw new DatasetLoadException(message);
            }
            throw new DatasetLoadException(message, failures.get(0));
        }

        TransactionSet snapshot = new TransactionSet(
                writer.getCollected(),
                processor.getRejections(),
                location,
                clock.instant()
        );
        snapshotHolder.publish(snapshot);
        writer.reset();

        log.info("Successfully loaded {} records from {} ({} rejected)",
                snapshot.size(), location, snapshot.rejectedCount());
        return DatasetLoadReport.of(snapshot);
    }
}
