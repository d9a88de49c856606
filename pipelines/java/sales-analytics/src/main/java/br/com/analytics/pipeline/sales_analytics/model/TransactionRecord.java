package br.com.analytics.pipeline.sales_analytics.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;

public record TransactionRecord(
        String transactionId,
        String productName,
        String category,
        BigDecimal price,
        Integer quantity,
        BigDecimal revenue,
        Integer customerAge,
        LocalDate purchaseDate,
        @Nullable BigDecimal customerRating
) {

    public Optional<BigDecimal> rating() {
        return Optional.ofNullable(customerRating);
    }

    public YearMonth purchaseMonth() {
        return YearMonth.from(purchaseDate);
    }
}
