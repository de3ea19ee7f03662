package com.sentindex.index.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.PersistedIndexValue;

import java.math.BigDecimal;
import java.time.Instant;

/** Latest persisted value; {@code delta24hPct} is {@code null} until a value 24h older exists. */
public record LatestIndexResponse(
    @JsonProperty("index_name")     String indexName,
    @JsonProperty("index_value")    BigDecimal indexValue,
    @JsonProperty("method")         CalculationMethod method,
    @JsonProperty("coverage_ratio") BigDecimal coverageRatio,
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("delta_24h_pct")  BigDecimal delta24hPct
) {
    public static LatestIndexResponse of(PersistedIndexValue value, BigDecimal delta24hPct) {
        return new LatestIndexResponse(value.indexName(), value.indexValue(), value.method(),
                                       value.coverageRatio(), value.time(), delta24hPct);
    }
}
