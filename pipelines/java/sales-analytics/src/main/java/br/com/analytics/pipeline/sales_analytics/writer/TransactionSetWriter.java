package br.com.analytics.pipeline.sales_analytics.writer;

import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects validated records in memory, in file order, until the loader builds a snapshot from them.
 */
public class TransactionSetWriter implements ItemWriter<TransactionRecord> {

    private static final Logger log = LoggerFactory.getLogger(TransactionSetWriter.class);

    private final List<TransactionRecord> collected = new ArrayList<>();

    @Override
    public void write(Chunk<? extends TransactionRecord> chunk) throws Exception {
        collected.addAll(chunk.getItems());
        log.debug("Collected chunk of {} transactions ({} so far).", chunk.size(), collected.size());
    }

    public List<TransactionRecord> getCollected() {
        return List.copyOf(collected);
    }

    public void reset() {
        collected.clear();
    }
}
