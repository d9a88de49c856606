package br.com.analytics.pipeline.sales_analytics.engine;

import br.com.analytics.pipeline.sales_analytics.model.RankedEntity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Orders entities by revenue, highest first, ties by name ascending.
 */
public class RankingEngine {

    public <T> List<T> order(Collection<T> entities, Function<T, String> name, Function<T, BigDecimal> revenue) {
        Comparator<T> byRevenueDescending = Comparator.comparing(revenue).reversed();
        return entities.stream()
                .sorted(byRevenueDescending.thenComparing(name))
                .toList();
    }

    /**
     * The {@code limit} highest-revenue entities, ranked from 1. Contributions are shares of the revenue of the whole
     * collection, not of the returned top entries.
     */
    public <T> List<RankedEntity> top(Collection<T> entities, Function<T, String> name,
                                      Function<T, BigDecimal> revenue, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1 but was " + limit);
        }
        BigDecimal grandTotal = entities.stream()
                .map(revenue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<T> ordered = order(entities, name, revenue);
        List<RankedEntity> ranked = new ArrayList<>(Math.min(limit, ordered.size()));
        for (int i = 0; i < ordered.size() && i < limit; i++) {
            T entity = ordered.get(i);
            ranked.add(new RankedEntity(
                    name.apply(entity),
                    revenue.apply(entity),
                    Percentages.share(revenue.apply(entity), grandTotal),
                    i + 1
            ));
        }
        return ranked;
    }
}
