package com.sentindex.common.composer;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Unrounded output of one {@link IndexCalculationStrategy} run.
 *
 * <p>{@code rawValue} carries full precision; rounding happens exactly once, in
 * {@link IndexComposer}. {@code usedWeight} is the summed weight of {@code symbolsUsed}.
 */
public record WeightedComputation(
    BigDecimal rawValue,
    BigDecimal usedWeight,
    List<String> symbolsUsed,
    List<String> symbolsMissing,
    Map<String, BigDecimal> pricesUsed
) {}
