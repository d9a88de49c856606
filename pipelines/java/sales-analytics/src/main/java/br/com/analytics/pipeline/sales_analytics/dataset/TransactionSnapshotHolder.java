package br.com.analytics.pipeline.sales_analytics.dataset;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the currently published {@link TransactionSet}. A reload swaps the reference in one step, so readers
 * never observe a half-built dataset and need no locking.
 */
@Component
public class TransactionSnapshotHolder {

    private final AtomicReference<TransactionSet> current = new AtomicReference<>(TransactionSet.empty());

    public TransactionSet current() {
        return current.get();
    }

    public TransactionSet publish(TransactionSet snapshot) {
        return current.getAndSet(snapshot);
    }
}
