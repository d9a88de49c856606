package br.com.analytics.pipeline.sales_analytics.dataset;

import br.com.analytics.pipeline.sales_analytics.model.RejectionReason;

import java.time.Instant;
import java.util.Map;

public record DatasetLoadReport(
        Integer recordsLoaded,
        Long recordsRejected,
        Map<RejectionReason, Long> rejections,
        String source,
        Instant loadedAt
) {

    public static DatasetLoadReport of(TransactionSet snapshot) {
        return new DatasetLoadReport(
                snapshot.size(),
                snapshot.rejectedCount(),
                snapshot.rejections(),
                snapshot.source(),
                snapshot.loadedAt()
        );
    }
}
