package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Everything the insight requester embeds in its prompt.
 *
 * <p>{@code config} and {@code delta24hPct} are optional enrichments; the prompt omits the
 * corresponding lines when they are {@code null}.
 */
public record InsightRequest(
    @JsonProperty("index_name")    String indexName,
    @JsonProperty("index_value")   BigDecimal value,
    @JsonProperty("prices")        PriceSet prices,
    @JsonProperty("delta_24h_pct") BigDecimal delta24hPct,
    @JsonProperty("config")        IndexConfig config
) {
    public static InsightRequest of(String indexName, BigDecimal value, PriceSet prices) {
        return new InsightRequest(indexName, value, prices, null, null);
    }
}
