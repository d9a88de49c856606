package br.com.analytics.pipeline.sales_analytics.config;

import br.com.analytics.pipeline.sales_analytics.model.RawTransactionRow;
import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;
import br.com.analytics.pipeline.sales_analytics.processor.TransactionValidationProcessor;
import br.com.analytics.pipeline.sales_analytics.reader.BlankLineRecordSeparatorPolicy;
import br.com.analytics.pipeline.sales_analytics.reader.TransactionRowFieldSetMapper;
import br.com.analytics.pipeline.sales_analytics.writer.TransactionSetWriter;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.EnableJdbcJobRepository;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.List;

@Configuration
@EnableBatchProcessing
@EnableJdbcJobRepository
public class SalesDatasetBatchConfig {

    private final JobRepository jobRepository;
    private final AnalyticsProperties.Dataset datasetProperties;

    public SalesDatasetBatchConfig(JobRepository jobRepository, AnalyticsProperties properties) {
        this.jobRepository = jobRepository;
        this.datasetProperties = properties.dataset();
    }

    @Bean
    public ItemReader<RawTransactionRow> transactionRowReader(ResourceLoader resourceLoader) {
        List<String> columns = datasetProperties.columns();
        if (!columns.containsAll(TransactionRowFieldSetMapper.REQUIRED_COLUMNS)) {
            throw new IllegalStateException("analytics.dataset.columns must name every column of "
                    + TransactionRowFieldSetMapper.REQUIRED_COLUMNS + " but was " + columns);
        }

        // non-strict: a row missing its trailing rating column still maps, with an empty rating
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setNames(columns.toArray(String[]::new));
        tokenizer.setStrict(false);

        return new FlatFileItemReaderBuilder<RawTransactionRow>()
                .name("transactionRowReader")
                .resource(resourceLoader.getResource(datasetProperties.location()))
                .encoding("UTF-8")
                .linesToSkip(1)
                .recordSeparatorPolicy(new BlankLineRecordSeparatorPolicy())
                .lineTokenizer(tokenizer)
                .fieldSetMapper(new TransactionRowFieldSetMapper())
                .build();
    }

    @Bean
    public TransactionValidationProcessor transactionValidationProcessor() {
        return new TransactionValidationProcessor();
    }

    @Bean
    public TransactionSetWriter transactionSetWriter() {
        return new TransactionSetWriter();
    }

    @Bean
    public Step transactionLoadStep(
            ItemReader<RawTransactionRow> reader,
            TransactionValidationProcessor processor,
            TransactionSetWriter writer
    ) {
        return new StepBuilder("transactionLoadStep", jobRepository)
                .<RawTransactionRow, TransactionRecord>chunk(datasetProperties.chunkSize())
                .reader(reader)
                .processor(processor)
                .writer(writer)
                .build();
    }

    @Bean
    public Job salesDatasetLoadJob(Step transactionLoadStep) {
        return new JobBuilder("salesDatasetLoadJob", jobRepository)
                .start(transactionLoadStep)
                .build();
    }
}
