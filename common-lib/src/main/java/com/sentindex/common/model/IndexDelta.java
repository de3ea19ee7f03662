package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest value of an index against the newest value at least 24 hours older.
 * {@code previousValue} and {@code deltaPct} are {@code null} when no such row exists.
 */
public record IndexDelta(
    @JsonProperty("index_name")     String indexName,
    @JsonProperty("index_value")    BigDecimal indexValue,
    @JsonProperty("time")           Instant time,
    @JsonProperty("previous_value") BigDecimal previousValue,
    @JsonProperty("previous_time")  Instant previousTime,
    @JsonProperty("delta_24h_pct")  BigDecimal deltaPct
) {}
