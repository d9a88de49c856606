package br.com.analytics.pipeline.sales_analytics.model;

import java.math.BigDecimal;

public record RankedEntity(
        String name,
        BigDecimal totalRevenue,
        BigDecimal contributionPercentage,
        Integer rank
) {
}
