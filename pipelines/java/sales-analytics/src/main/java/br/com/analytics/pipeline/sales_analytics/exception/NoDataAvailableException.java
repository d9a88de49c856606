package br.com.analytics.pipeline.sales_analytics.exception;

/**
 * The published dataset is empty and the requested computation needs at least one record.
 */
public class NoDataAvailableException extends AnalyticsException {

    public NoDataAvailableException() {
        super("No sales data available");
    }
}
