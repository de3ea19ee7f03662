package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit trail attached to every {@link IndexResult}: exactly which inputs, configuration
 * and method produced the value. Self-contained; an auditor needs no other system to
 * reproduce the computation.
 *
 * <ul>
 *   <li>{@code symbolsUsed} / {@code symbolsMissing}: in configuration order</li>
 *   <li>{@code symbolsIgnored}: supplied prices the configuration does not weight</li>
 *   <li>{@code pricesUsed}: the prices that entered the weighted sum</li>
 *   <li>{@code config}: snapshot of weights, base prices, base level and base date</li>
 *   <li>{@code previousPrices} / {@code previousValue}: return-based only, otherwise null</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProvenanceRecord(
    @JsonProperty("symbols_used")    List<String> symbolsUsed,
    @JsonProperty("symbols_missing") List<String> symbolsMissing,
    @JsonProperty("symbols_ignored") List<String> symbolsIgnored,
    @JsonProperty("prices_used")     Map<String, BigDecimal> pricesUsed,
    @JsonProperty("config")          IndexConfig config,
    @JsonProperty("method")          CalculationMethod method,
    @JsonProperty("previous_prices") Map<String, BigDecimal> previousPrices,
    @JsonProperty("previous_value")  BigDecimal previousValue,
    @JsonProperty("computed_at")     Instant computedAt
) {
    public ProvenanceRecord {
        symbolsUsed    = symbolsUsed    == null ? List.of() : List.copyOf(symbolsUsed);
        symbolsMissing = symbolsMissing == null ? List.of() : List.copyOf(symbolsMissing);
        symbolsIgnored = symbolsIgnored == null ? List.of() : List.copyOf(symbolsIgnored);
        pricesUsed     = pricesUsed     == null ? Map.of()  : PriceSet.of(pricesUsed).prices();
        previousPrices = previousPrices == null ? null      : PriceSet.of(previousPrices).prices();
    }
}
