package br.com.analytics.pipeline.sales_analytics.web;

import br.com.analytics.pipeline.sales_analytics.payload.DatasetStatusResponse;
import br.com.analytics.pipeline.sales_analytics.service.SalesAnalyticsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dataset")
public class DatasetController {

    private final SalesAnalyticsService analyticsService;

    public DatasetController(SalesAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping
    public DatasetStatusResponse status() {
        return analyticsService.datasetStatus();
    }

    /**
     * Re-reads the sales file and swaps in the new dataset. Requests already running keep the previous one.
     */
    @PostMapping("/reload")
    public DatasetStatusResponse reload() {
        return analyticsService.reloadDataset();
    }
}
