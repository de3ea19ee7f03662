package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sentindex.common.exception.ComputationException;

import java.util.Locale;

/**
 * Algorithm used to blend a price set into a single index value.
 *
 * <ul>
 *   <li>{@code LEVEL_NORMALIZED}: each asset contributes its move relative to its base price (default)</li>
 *   <li>{@code RETURN_BASED}: each asset contributes its period return; needs the prior period</li>
 * </ul>
 */
public enum CalculationMethod {

    LEVEL_NORMALIZED("level_normalized"),
    RETURN_BASED("return_based");

    private final String wireName;

    CalculationMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses the wire form ({@code level_normalized} / {@code return_based}, case-insensitive).
     * A missing value selects {@link #LEVEL_NORMALIZED}.
     *
     * @throws ComputationException with reason {@code unsupported_method} for any other value
     */
    @JsonCreator
    public static CalculationMethod fromWire(String value) {
        if (value == null || value.isBlank()) {
            return LEVEL_NORMALIZED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CalculationMethod method : values()) {
            if (method.wireName.equals(normalized) || method.name().equalsIgnoreCase(normalized)) {
                return method;
            }
        }
        throw new ComputationException(ComputationException.UNSUPPORTED_METHOD,
            "unsupported calculation method '" + value + "'");
    }
}
