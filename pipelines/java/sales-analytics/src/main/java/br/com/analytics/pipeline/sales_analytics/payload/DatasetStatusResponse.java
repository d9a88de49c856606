package br.com.analytics.pipeline.sales_analytics.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record DatasetStatusResponse(
        @JsonProperty("records_loaded") Integer recordsLoaded,
        @JsonProperty("records_rejected") Long recordsRejected,
        @JsonProperty("rejections") Map<String, Long> rejections,
        @JsonProperty("source") String source,
        @JsonProperty("loaded_at") String loadedAt
) {
}
