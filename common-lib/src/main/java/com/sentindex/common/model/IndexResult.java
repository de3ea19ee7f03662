package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated composite index value with its provenance. Created once per computation and
 * never mutated; the pipeline keeps no reference after returning it.
 */
public record IndexResult(
    @JsonProperty("index_name")     String indexName,
    @JsonProperty("index_value")    BigDecimal value,
    @JsonProperty("method")         CalculationMethod method,
    @JsonProperty("coverage_ratio") BigDecimal coverageRatio,
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("provenance")     ProvenanceRecord provenance
) {}
