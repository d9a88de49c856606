package br.com.analytics.pipeline.sales_analytics.model;

/**
 * One CSV line as read from the sales file, before any validation.
 */
public record RawTransactionRow(
        String transactionId,
        String productName,
        String category,
        String price,
        String quantity,
        String revenue,
        String customerAge,
        String purchaseDate,
        String customerRating
) {
}
