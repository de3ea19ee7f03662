package com.sentindex.common.composer;

import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.PriorPeriod;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of {@link IndexComposer#compute}: the rounded value plus everything the
 * provenance recorder needs. {@code prior} is {@code null} for level-normalized runs.
 */
public record CompositionOutcome(
    IndexConfig config,
    BigDecimal value,
    CalculationMethod method,
    BigDecimal coverageRatio,
    List<String> symbolsUsed,
    List<String> symbolsMissing,
    Map<String, BigDecimal> pricesUsed,
    PriorPeriod prior
) {
    public CompositionOutcome {
        symbolsUsed    = List.copyOf(symbolsUsed);
        symbolsMissing = List.copyOf(symbolsMissing);
        pricesUsed     = Collections.unmodifiableMap(new LinkedHashMap<>(pricesUsed));
    }
}
