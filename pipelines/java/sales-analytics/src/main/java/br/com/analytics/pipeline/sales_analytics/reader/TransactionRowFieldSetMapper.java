package br.com.analytics.pipeline.sales_analytics.reader;

import br.com.analytics.pipeline.sales_analytics.model.RawTransactionRow;
import org.springframework.batch.infrastructure.item.file.mapping.FieldSetMapper;
import org.springframework.batch.infrastructure.item.file.transform.FieldSet;

import java.util.List;

public class TransactionRowFieldSetMapper implements FieldSetMapper<RawTransactionRow> {

    public static final String TRANSACTION_ID = "transaction_id";
    public static final String PRODUCT_NAME = "product_name";
    public static final String CATEGORY = "category";
    public static final String PRICE = "price";
    public static final String QUANTITY = "quantity";
    public static final String REVENUE = "revenue";
    public static final String CUSTOMER_AGE = "customer_age";
    public static final String PURCHASE_DATE = "purchase_date";
    public static final String CUSTOMER_RATING = "customer_rating";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            TRANSACTION_ID, PRODUCT_NAME, CATEGORY, PRICE, QUANTITY,
            REVENUE, CUSTOMER_AGE, PURCHASE_DATE, CUSTOMER_RATING
    );

    @Override
    public RawTransactionRow mapFieldSet(FieldSet fieldSet) {
        return new RawTransactionRow(
                fieldSet.readString(TRANSACTION_ID),
                fieldSet.readString(PRODUCT_NAME),
                fieldSet.readString(CATEGORY),
                fieldSet.readString(PRICE),
                fieldSet.readString(QUANTITY),
                fieldSet.readString(REVENUE),
                fieldSet.readString(CUSTOMER_AGE),
                fieldSet.readString(PURCHASE_DATE),
                fieldSet.readString(CUSTOMER_RATING)
        );
    }
}
