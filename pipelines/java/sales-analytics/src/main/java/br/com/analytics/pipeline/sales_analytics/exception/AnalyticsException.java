package br.com.analytics.pipeline.sales_analytics.exception;

/**
 * Base class of the failures the analytics service reports to its callers.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
