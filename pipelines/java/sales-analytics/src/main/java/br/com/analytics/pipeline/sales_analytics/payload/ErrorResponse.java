package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope returned for every failed request.
 */
public record ErrorResponse(
        @JsonProperty("detail") String detail,
        @JsonProperty("status_code") Integer statusCode,
        @JsonProperty("timestamp") String timestamp
) {
}
