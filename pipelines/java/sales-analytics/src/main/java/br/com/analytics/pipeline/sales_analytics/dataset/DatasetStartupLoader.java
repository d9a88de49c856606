package br.com.analytics.pipeline.sales_analytics.dataset;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Loads the dataset once the context is up. A failure here aborts startup.
 */
@Component
@ConditionalOnProperty(prefix = "analytics.dataset", name = "load-on-startup", havingValue = "true", matchIfMissing = true)
public class DatasetStartupLoader implements ApplicationRunner {

    private final SalesDatasetLoader loader;

    public DatasetStartupLoader(SalesDatasetLoader loader) {
        this.loader = loader;
    }

    @Override
    public void run(ApplicationArguments args) {
        loader.reload();
    }
}
