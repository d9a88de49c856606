package br.com.analytics.pipeline.sales_analytics.exception;

/**
 * A caller-supplied parameter is outside its documented range.
 */
public class InvalidParameterException extends AnalyticsException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
