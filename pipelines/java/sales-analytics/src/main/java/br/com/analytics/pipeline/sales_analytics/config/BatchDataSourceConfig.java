package br.com.analytics.pipeline.sales_analytics.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Job repository storage. Every dataset load is its own job instance and the repository keeps them apart. The
 * default in-memory H2 database keeps load history for the lifetime of the process only. The bean names are the
 * ones {@code @EnableBatchProcessing} and {@code @EnableJdbcJobRepository} look up.
 */
@Configuration
public class BatchDataSourceConfig {

    private static final String BATCH_SCHEMA = "org/springframework/batch/core/schema-h2.sql";
    private static final String BATCH_SCHEMA_DROP = "org/springframework/batch/core/schema-drop-h2.sql";

    private final Environment env;

    public BatchDataSourceConfig(Environment env) {
        this.env = env;
    }

    @Bean(name = "dataSource")
    public DataSource batchDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("sales-batch");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.batch.driver-class-name", "org.h2.Driver"));
        dataSource.setJdbcUrl(env.getProperty("spring.datasource.batch.url",
                "jdbc:h2:mem:sales_batch;DB_CLOSE_DELAY=-1"));
        dataSource.setUsername(env.getProperty("spring.datasource.batch.username", "sa"));
        dataSource.setPassword(env.getProperty("spring.datasource.batch.password", ""));
        return dataSource;
    }

    @Bean(name = "transactionManager")
    public DataSourceTransactionManager batchTransactionManager(DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    @Bean
    public DataSourceInitializer batchSchemaInitializer(DataSource batchDataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource(BATCH_SCHEMA_DROP));
        populator.addScript(new ClassPathResource(BATCH_SCHEMA));
        populator.setIgnoreFailedDrops(true);

        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(batchDataSource);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }
}
