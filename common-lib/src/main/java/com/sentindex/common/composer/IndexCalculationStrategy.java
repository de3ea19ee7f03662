package com.sentindex.common.composer;

import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.PriceSet;
import com.sentindex.common.model.PriorPeriod;

import java.math.MathContext;

/**
 * Strategy contract for blending a price set into an index value.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no I/O and no clock reads</li>
 *   <li><b>Unrounded</b>: accumulate at {@link #PRECISION}; the composer rounds once</li>
 * </ul>
 *
 * <p>Symbols configured but absent from the inputs are skipped and reported as missing;
 * symbols present in the inputs but not configured are ignored.
 *
 * <p>Current implementations: {@link LevelNormalizedStrategy}, {@link ReturnBasedStrategy}.
 */
public interface IndexCalculationStrategy {

    MathContext PRECISION = MathContext.DECIMAL128;

    CalculationMethod method();

    /**
     * @param config validated index configuration
     * @param prices current prices
     * @param prior  previous period, {@code null} when none is known
     * @return the unrounded weighted value with its coverage bookkeeping, never {@code null}
     */
    WeightedComputation compute(IndexConfig config, PriceSet prices, PriorPeriod prior);
}
