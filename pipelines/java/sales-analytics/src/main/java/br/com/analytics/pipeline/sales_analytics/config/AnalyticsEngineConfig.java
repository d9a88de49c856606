package br.com.analytics.pipeline.sales_analytics.config;

import br.com.analytics.pipeline.sales_analytics.engine.Aggregator;
import br.com.analytics.pipeline.sales_analytics.engine.ForecastEstimator;
import br.com.analytics.pipeline.sales_analytics.engine.RankingEngine;
import br.com.analytics.pipeline.sales_analytics.engine.ResponseAssembler;
import br.com.analytics.pipeline.sales_analytics.engine.Segmenter;
import br.com.analytics.pipeline.sales_analytics.engine.TrendAnalyzer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Aggregator aggregator() {
        return new Aggregator();
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(Aggregator aggregator, AnalyticsProperties properties) {
        return new TrendAnalyzer(aggregator, properties.trend().stableBand());
    }

    @Bean
    public Segmenter segmenter(Aggregator aggregator) {
        return new Segmenter(aggregator);
    }

    @Bean
    public RankingEngine rankingEngine() {
        return new RankingEngine();
    }

    @Bean
    public ForecastEstimator forecastEstimator(AnalyticsProperties properties) {
        AnalyticsProperties.Forecast forecast = properties.forecast();
        return new ForecastEstimator(
                forecast.windowMonths(),
                forecast.growthFactor(),
                forecast.stableThreshold(),
                forecast.volatileThreshold(),
                forecast.keyDriverCategories()
        );
    }

    @Bean
    public ResponseAssembler responseAssembler(Clock clock) {
        return new ResponseAssembler(clock);
    }
}
