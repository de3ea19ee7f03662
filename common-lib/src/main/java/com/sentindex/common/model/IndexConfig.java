package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named index definition supplied by the configuration collaborator.
 *
 * <p>Read-only during a computation. Invariants (same key set for {@code weights} and
 * {@code basePrices}, weights summing to 1, positive base prices) are checked by
 * {@link com.sentindex.common.composer.IndexConfigValidator}, not here, so that a bad
 * configuration can still be loaded, listed and reported.
 */
public record IndexConfig(
    @JsonProperty("name")        String name,
    @JsonProperty("base_level")  BigDecimal baseLevel,
    @JsonProperty("base_date")   LocalDate baseDate,
    @JsonProperty("weights")     Map<String, BigDecimal> weights,
    @JsonProperty("base_prices") Map<String, BigDecimal> basePrices
) {
    public IndexConfig {
        weights    = weights    == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        basePrices = basePrices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(basePrices));
    }
}
