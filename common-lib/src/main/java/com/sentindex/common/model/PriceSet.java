package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sentindex.common.exception.ValidationException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Asset prices observed at a single instant, keyed by symbol.
 *
 * <p>Every value is strictly positive; construction fails with
 * {@link ValidationException} otherwise. Iteration order is the insertion order.
 */
public record PriceSet(@JsonValue Map<String, BigDecimal> prices) {

    public PriceSet {
        if (prices == null) {
            prices = Map.of();
        }
        Map<String, BigDecimal> copy = new LinkedHashMap<>();
        for (Map.Entry<String, BigDecimal> e : prices.entrySet()) {
            BigDecimal value = e.getValue();
            if (value == null || value.signum() <= 0) {
                throw ValidationException.nonPositivePrice(e.getKey(), value);
            }
            copy.put(e.getKey(), value);
        }
        prices = Collections.unmodifiableMap(copy);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PriceSet of(Map<String, BigDecimal> prices) {
        return new PriceSet(prices);
    }

    public static PriceSet empty() {
        return new PriceSet(Map.of());
    }

    public boolean contains(String symbol) {
        return prices.containsKey(symbol);
    }

    /** @return the price for {@code symbol}, or {@code null} when absent */
    public BigDecimal get(String symbol) {
        return prices.get(symbol);
    }

    public Set<String> symbols() {
        return prices.keySet();
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }
}
