package br.com.analytics.pipeline.sales_analytics.reader;

import br.com.analytics.pipeline.sales_analytics.model.RawTransactionRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.batch.infrastructure.item.file.transform.DelimitedLineTokenizer;
import org.springframework.core.io.ByteArrayResource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BlankLineRecordSeparatorPolicy Tests")
class BlankLineRecordSeparatorPolicyTest {

    private static final String HEADER =
            "transaction_id,product_name,category,price,quantity,revenue,customer_age,purchase_date,customer_rating\n";

    private static List<RawTransactionRow> readAll(String csv) throws Exception {
        DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
        tokenizer.setNames(TransactionRowFieldSetMapper.REQUIRED_COLUMNS.toArray(String[]::new));
        tokenizer.setStrict(false);

        FlatFileItemReader<RawTransactionRow> reader = new FlatFileItemReaderBuilder<RawTransactionRow>()
                .name("blankLineTestReader")
                .resource(new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)))
                .linesToSkip(1)
                .recordSeparatorPolicy(new BlankLineRecordSeparatorPolicy())
                .lineTokenizer(tokenizer)
                .fieldSetMapper(new TransactionRowFieldSetMapper())
                .build();

        List<RawTransactionRow> rows = new ArrayList<>();
        reader.open(new ExecutionContext());
        try {
            RawTransactionRow row;
            while ((row = reader.read()) != null) {
                rows.add(row);
            }
        } finally {
            reader.close();
        }
        return rows;
    }

    @Test
    @DisplayName("Should not emit rows for blank lines between or after records")
    void shouldSkipBlankLines() throws Exception {
        // Given
        String csv = HEADER
                + "TXN-1,Lamp,Home & Kitchen,35.00,1,35.00,29,2024-01-09,4\n"
                + "\n"
                + "   \n"
                + "TXN-2,Novel,Books,12.50,2,25.00,41,2024-01-10,\n"
                + "\n"
                + "\n";

        // When
        List<RawTransactionRow> rows = readAll(csv);

        // Then
        assertThat(rows).extracting(RawTransactionRow::transactionId).containsExactly("TXN-1", "TXN-2");
        assertThat(rows.get(1).productName()).isEqualTo("Novel");
    }

    @Test
    @DisplayName("Should read nothing from a file with only a header and blank lines")
    void shouldReadNothingFromBlankFile() throws Exception {
        assertThat(readAll(HEADER + "\n\n")).isEmpty();
    }

    @Test
    @DisplayName("Should treat only whitespace as blank")
    void shouldRecognizeBlankRecords() {
        BlankLineRecordSeparatorPolicy policy = new BlankLineRecordSeparatorPolicy();

        assertThat(policy.isEndOfRecord("  ")).isFalse();
        assertThat(policy.isEndOfRecord("TXN-1,Lamp")).isTrue();
        assertThat(policy.postProcess(" ")).isNull();
        assertThat(policy.postProcess("TXN-1,Lamp")).isEqualTo("TXN-1,Lamp");
    }
}
