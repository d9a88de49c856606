package br.com.analytics.pipeline.sales_analytics.model;

public enum TrendDirection {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
