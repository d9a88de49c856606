package br.com.analytics.pipeline.sales_analytics.model;

import java.util.Optional;

/**
 * Fixed customer age bins. Lower bound inclusive, upper bound exclusive; the last bin is open-ended.
 */
public enum AgeBucket {

    AGE_18_25("18-25", 18, 26),
    AGE_26_35("26-35", 26, 36),
    AGE_36_45("36-45", 36, 46),
    AGE_46_55("46-55", 46, 56),
    AGE_56_PLUS("56+", 56, Integer.MAX_VALUE);

    private final String label;
    private final int lowerInclusive;
    private final int upperExclusive;

    AgeBucket(String label, int lowerInclusive, int upperExclusive) {
        this.label = label;
        this.lowerInclusive = lowerInclusive;
        this.upperExclusive = upperExclusive;
    }

    public String label() {
        return label;
    }

    public boolean contains(int age) {
        return age >= lowerInclusive && age < upperExclusive;
    }

    public static Optional<AgeBucket> of(int age) {
        for (AgeBucket bucket : values()) {
            if (bucket.contains(age)) {
                return Optional.of(bucket);
            }
        }
        return Optional.empty();
    }
}
