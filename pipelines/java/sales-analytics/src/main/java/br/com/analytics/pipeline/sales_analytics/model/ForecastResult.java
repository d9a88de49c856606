package br.com.analytics.pipeline.sales_analytics.model;

import java.math.BigDecimal;
import java.util.List;

public record ForecastResult(
        BigDecimal predictedNextPeriodRevenue,
        ConfidenceLevel confidenceLevel,
        List<String> keyDrivers
) {

    public ForecastResult {
        keyDrivers = List.copyOf(keyDrivers);
    }
}
