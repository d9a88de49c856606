package br.com.analytics.pipeline.sales_analytics.processor;

import br.com.analytics.pipeline.sales_analytics.model.RawTransactionRow;
import br.com.analytics.pipeline.sales_analytics.model.RejectionReason;
import br.com.analytics.pipeline.sales_analytics.model.TransactionRecord;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.annotation.AfterStep;
import org.springframework.batch.core.step.StepExecution;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw CSV rows into {@link TransactionRecord}s. Rows with a missing, unparseable or out-of-range field are
 * filtered out (the processor returns {@code null}) and counted per {@link RejectionReason}; they are never coerced.
 */
public class TransactionValidationProcessor implements ItemProcessor<RawTransactionRow, TransactionRecord> {

    private static final Logger log = LoggerFactory.getLogger(TransactionValidationProcessor.class);

    private static final int MIN_CUSTOMER_AGE = 18;
    private static final int MAX_CUSTOMER_AGE = 120;
    private static final BigDecimal MIN_RATING = BigDecimal.ONE;
    private static final BigDecimal MAX_RATING = BigDecimal.valueOf(5);
    private static final BigDecimal REVENUE_TOLERANCE = new BigDecimal("0.01");
    private static final Set<String> ABSENT_MARKERS = Set.of("", "nan", "null", "none", "n/a");

    private final EnumMap<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);
    private final Set<String> loadedTransactionIds = new HashSet<>();

    public Map<RejectionReason, Long> getRejections() {
        return new EnumMap<>(rejections);
    }

    /**
     * Clears counters and the duplicate-id memory before a new load.
     */
    public void reset() {
        rejections.clear();
        loadedTransactionIds.clear();
    }

    @Override
    public @Nullable TransactionRecord process(RawTransactionRow row) throws Exception {
        try {
            TransactionRecord record = toRecord(row);
            if (!loadedTransactionIds.add(record.transactionId())) {
                throw new MalformedRowException(RejectionReason.DUPLICATE_TRANSACTION_ID,
                        "transaction id already loaded");
            }
            return record;
        } catch (MalformedRowException e) {
            rejections.merge(e.reason, 1L, Long::sum);
            log.warn("Rejected transaction '{}': {} ({})", row.transactionId(), e.getMessage(), e.reason);
            return null;
        }
    }

    private TransactionRecord toRecord(RawTransactionRow row) throws MalformedRowException {
        String transactionId = required(row.transactionId(), "transaction_id");
        String productName = required(row.productName(), "product_name");
        String category = required(row.category(), "category");

        BigDecimal price = decimal(required(row.price(), "price"), "price");
        if (price.signum() <= 0) {
            throw new MalformedRowException(RejectionReason.NON_POSITIVE_PRICE, "price must be positive: " + price);
        }

        int quantity = integer(required(row.quantity(), "quantity"), "quantity");
        if (quantity <= 0) {
            throw new MalformedRowException(RejectionReason.NON_POSITIVE_QUANTITY,
                    "quantity must be positive: " + quantity);
        }

        int customerAge = integer(required(row.customerAge(), "customer_age"), "customer_age");
        if (customerAge < MIN_CUSTOMER_AGE || customerAge > MAX_CUSTOMER_AGE) {
            throw new MalformedRowException(RejectionReason.AGE_OUT_OF_RANGE,
                    "customer_age out of range: " + customerAge);
        }

        LocalDate purchaseDate = date(required(row.purchaseDate(), "purchase_date"));

        BigDecimal expectedRevenue = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal revenue = expectedRevenue;
        if (!isAbsent(row.revenue())) {
            revenue = decimal(row.revenue(), "revenue");
            if (revenue.subtract(expectedRevenue).abs().compareTo(REVENUE_TOLERANCE) > 0) {
                throw new MalformedRowException(RejectionReason.REVENUE_MISMATCH,
                        "revenue " + revenue + " does not match price * quantity = " + expectedRevenue);
            }
        }

        BigDecimal rating = null;
        if (!isAbsent(row.customerRating())) {
            rating = decimal(row.customerRating(), "customer_rating");
            if (rating.compareTo(MIN_RATING) < 0 || rating.compareTo(MAX_RATING) > 0) {
                throw new MalformedRowException(RejectionReason.RATING_OUT_OF_RANGE,
                        "customer_rating out of range: " + rating);
            }
        }

        return new TransactionRecord(
                transactionId,
                productName,
                category,
                price,
                quantity,
                revenue,
                customerAge,
                purchaseDate,
                rating
        );
    }

    private static boolean isAbsent(@Nullable String value) {
        return value == null || ABSENT_MARKERS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String required(@Nullable String value, String field) throws MalformedRowException {
        if (isAbsent(value)) {
            throw new MalformedRowException(RejectionReason.MISSING_FIELD, field + " is missing");
        }
        return value.trim();
    }

    private static BigDecimal decimal(String value, String field) throws MalformedRowException {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRowException(RejectionReason.INVALID_NUMBER, field + " is not a number: " + value);
        }
    }

    // pandas exports integer columns with missing values as floats ("2.0")
    private static int integer(String value, String field) throws MalformedRowException {
        try {
            return decimal(value, field).intValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedRowException(RejectionReason.INVALID_NUMBER, field + " is not an integer: " + value);
        }
    }

    private static LocalDate date(String value) throws MalformedRowException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            if (value.length() > 10 && (value.charAt(10) == 'T' || value.charAt(10) == ' ')) {
                return date(value.substring(0, 10));
            }
            throw new MalformedRowException(RejectionReason.INVALID_DATE, "purchase_date is not a date: " + value);
        }
    }

    @AfterStep
    public void afterStep(StepExecution stepExecution) {
        log.info("Transaction validation complete. {} rows accepted, {} rejected.",
                stepExecution.getWriteCount(), stepExecution.getFilterCount());
    }

    private static final class MalformedRowException extends Exception {

        private final RejectionReason reason;

        private MalformedRowException(RejectionReason reason, String message) {
            super(message);
            this.reason = reason;
        }
    }
}
