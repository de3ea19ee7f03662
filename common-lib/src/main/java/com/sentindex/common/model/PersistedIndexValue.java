package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of the time-series store: a computed index value keyed by {@code (time, indexName)}
 * with its provenance as payload.
 */
public record PersistedIndexValue(
    @JsonProperty("time")           Instant time,
    @JsonProperty("index_name")     String indexName,
    @JsonProperty("index_value")    BigDecimal indexValue,
    @JsonProperty("method")         CalculationMethod method,
    @JsonProperty("coverage_ratio") BigDecimal coverageRatio,
    @JsonProperty("payload")        ProvenanceRecord payload
) {
    public static PersistedIndexValue from(IndexResult result) {
        return new PersistedIndexValue(result.timestamp(), result.indexName(), result.value(),
                                       result.method(), result.coverageRatio(), result.provenance());
    }

    /**
     * The row viewed as the previous period of a return-based computation: its value and the
     * prices that produced it.
     */
    public PriorPeriod toPriorPeriod() {
        PriceSet prices = payload == null ? PriceSet.empty() : PriceSet.of(payload.pricesUsed());
        return new PriorPeriod(prices, indexValue, time);
    }
}
