package br.com.analytics.pipeline.sales_analytics.model;

public enum ValueSegment {

    HIGH("High Value", "Orders > $200"),
    MEDIUM("Medium Value", "Orders $50-$200"),
    LOW("Low Value", "Orders < $50");

    private final String label;
    private final String criteria;

    ValueSegment(String label, String criteria) {
        this.label = label;
        this.criteria = criteria;
    }

    public String label() {
        return label;
    }

    public String criteria() {
        return criteria;
    }
}
