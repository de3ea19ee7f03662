package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of the previously computed period, required by the return-based method.
 *
 * <p>Fetched once by the caller from the time-series collaborator and handed to the
 * composer explicitly. {@code time} is informational and may be {@code null} when the
 * caller supplied the previous prices and level directly.
 */
public record PriorPeriod(
    @JsonProperty("prices") PriceSet prices,
    @JsonProperty("value")  BigDecimal value,
    @JsonProperty("time")   Instant time
) {
    public static PriorPeriod of(PriceSet prices, BigDecimal value) {
        return new PriorPeriod(prices, value, null);
    }
}
