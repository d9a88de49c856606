package br.com.analytics.pipeline.sales_analytics.model;

/**
 * Why a CSV row was excluded from the dataset.
 */
public enum RejectionReason {
    MISSING_FIELD,
    INVALID_NUMBER,
    INVALID_DATE,
    NON_POSITIVE_PRICE,
    NON_POSITIVE_QUANTITY,
    AGE_OUT_OF_RANGE,
    RATING_OUT_OF_RANGE,
    REVENUE_MISMATCH,
    DUPLICATE_TRANSACTION_ID
}
