package br.com.analytics.pipeline.sales_analytics.web;

import br.com.analytics.pipeline.sales_analytics.payload.HealthResponse;
import br.com.analytics.pipeline.sales_analytics.service.SalesAnalyticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final SalesAnalyticsService analyticsService;

    public HealthController(SalesAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return analyticsService.health();
    }
}
