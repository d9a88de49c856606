package br.com.analytics.pipeline.sales_analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAnalyticsApplication.class, args);
    }
}
