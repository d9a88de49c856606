package br.com.analytics.pipeline.sales_analytics.reader;

import org.springframework.batch.infrastructure.item.file.separator.SimpleRecordSeparatorPolicy;

/**
 * Skips blank lines instead of handing them to the tokenizer as a record of empty fields. A blank line before a
 * record is absorbed into it; blank lines at the end of the file end the input.
 */
public class BlankLineRecordSeparatorPolicy extends SimpleRecordSeparatorPolicy {

    @Override
    public boolean isEndOfRecord(String record) {
        return !record.isBlank() && super.isEndOfRecord(record);
    }

    @Override
    public String postProcess(String record) {
        if (record == null || record.isBlank()) {
            return null;
        }
        return super.postProcess(record);
    }

    @Override
    public String preProcess(String record) {
        return record.isBlank() ? "" : super.preProcess(record);
    }
}
