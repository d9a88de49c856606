package br.com.analytics.pipeline.sales_analytics.exception;

public class DatasetLoadException extends AnalyticsException {

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
