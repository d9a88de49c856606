package br.com.analytics.pipeline.sales_analytics.dataset;

import br.com.analytics.pipeline.sales_analytics.model.RejectionReason;
import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the validated transactions, together with the diagnostics of the load that produced it.
 * Every analytics computation reads exactly one snapshot.
 */
public record TransactionSet(
        List<TransactionRecord> records,
        Map<RejectionReason, Long> rejections,
        String source,
        Instant loadedAt
) {

    private static final String IN_MEMORY_SOURCE = "in-memory";

    public TransactionSet {
        records = List.copyOf(records);
        EnumMap<RejectionReason, Long> copy = new EnumMap<>(RejectionReason.class);
        copy.putAll(rejections);
        rejections = Collections.unmodifiableMap(copy);
    }

    public static TransactionSet empty() {
        return new TransactionSet(List.of(), Map.of(), IN_MEMORY_SOURCE, Instant.EPOCH);
    }

    public static TransactionSet of(List<TransactionRecord> records) {
        return new TransactionSet(records, Map.of(), IN_MEMORY_SOURCE, Instant.now());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public long rejectedCount() {
        return rejections.values().stream().mapToLong(Long::longValue).sum();
    }

    public Optional<LocalDate> latestPurchaseDate() {
        return records.stream()
                .map(TransactionRecord::purchaseDate)
                .max(Comparator.naturalOrder());
    }

    /**
     * Records purchased within {@code [fromInclusive, toInclusive]}. Load diagnostics are carried over.
     */
    public TransactionSet between(LocalDate fromInclusive, LocalDate toInclusive) {
        List<TransactionRecord> window = records.stream()
                .filter(record -> !record.purchaseDate().isBefore(fromInclusive))
                .filter(record -> !record.purchaseDate().isAfter(toInclusive))
                .toList();
        return new TransactionSet(window, rejections, source, loadedAt);
    }
}
