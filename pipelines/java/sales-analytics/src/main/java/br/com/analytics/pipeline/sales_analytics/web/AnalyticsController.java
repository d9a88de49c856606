package br.com.analytics.pipeline.sales_analytics.web;

import br.com.analytics.pipeline.sales_analytics.payload.CategoriesResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DashboardResponse;
import br.com.analytics.pipeline.sales_analytics.payload.DemographicsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.ProductsResponse;
import br.com.analytics.pipeline.sales_analytics.payload.RevenueInsightsResponse;
import br.com.analytics.pipeline.sales_analytics.service.SalesAnalyticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AnalyticsController {

    private final SalesAnalyticsService analyticsService;

    public AnalyticsController(SalesAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/products")
    public ProductsResponse products() {
        return analyticsService.products();
    }

    @GetMapping("/dashboard")
    public DashboardResponse dashboard(
            @RequestParam(name = "days", defaultValue = "30") int days) {
        return analyticsService.dashboard(days);
    }

    @GetMapping("/categories")
    public CategoriesResponse categories() {
        return analyticsService.categories();
    }

    @GetMapping("/demographics")
    public DemographicsResponse demographics() {
        return analyticsService.demographics();
    }

    @GetMapping("/revenue-insights")
    public RevenueInsightsResponse revenueInsights() {
        return analyticsService.revenueInsights();
    }
}
