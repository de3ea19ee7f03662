package com.sentindex.index.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/index/compute}.
 *
 * <p>{@code method} defaults to {@code level_normalized}; {@code minCoverage} to the configured
 * threshold. {@code prevPrices} and {@code prevIndexLevel} supply the prior period for
 * {@code return_based}; when either is absent the latest persisted value is used.
 */
public record ComputeRequest(
    @JsonProperty("index_name")       String indexName,
    @JsonProperty("prices")           Map<String, BigDecimal> prices,
    @JsonProperty("method")           String method,
    @JsonProperty("min_coverage")     BigDecimal minCoverage,
    @JsonProperty("prev_prices")      Map<String, BigDecimal> prevPrices,
    @JsonProperty("prev_index_level") BigDecimal prevIndexLevel
) {
    public static ComputeRequest of(String indexName, Map<String, BigDecimal> prices, String method) {
        return new ComputeRequest(indexName, prices, method, null, null, null);
    }
}
