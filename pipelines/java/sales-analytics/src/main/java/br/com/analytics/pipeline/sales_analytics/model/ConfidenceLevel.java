package br.com.analytics.pipeline.sales_analytics.model;

public enum ConfidenceLevel {

    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
