package com.sentindex.common.composer;

import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.exception.ValidationException;
import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.PriceSet;
import com.sentindex.common.model.PriorPeriod;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a composite index value from a price set and an index configuration.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Validate the configuration ({@link IndexConfigValidator}).</li>
 *   <li>Dispatch to the {@link IndexCalculationStrategy} registered for the method.</li>
 *   <li>{@code coverageRatio = usedWeight / totalWeight}; reject below {@code minCoverage}.</li>
 *   <li>Round the value to {@value #VALUE_SCALE} decimals, half-even, once.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe. Never persists; never reads a clock.
 */
public class IndexComposer {

    public static final BigDecimal DEFAULT_MIN_COVERAGE = new BigDecimal("0.5");
    public static final int VALUE_SCALE = 2;

    private final Map<CalculationMethod, IndexCalculationStrategy> strategies;
    private final IndexConfigValidator validator;
    private final BigDecimal defaultMinCoverage;

    public IndexComposer() {
        this(List.of(new LevelNormalizedStrategy(), new ReturnBasedStrategy()),
             new IndexConfigValidator(), DEFAULT_MIN_COVERAGE);
    }

    public IndexComposer(List<IndexCalculationStrategy> strategies,
                         IndexConfigValidator validator,
                         BigDecimal defaultMinCoverage) {
        this.strategies = new EnumMap<>(CalculationMethod.class);
        for (IndexCalculationStrategy strategy : strategies) {
            this.strategies.put(strategy.method(), strategy);
        }
        this.validator = validator;
        this.defaultMinCoverage = checkThreshold(defaultMinCoverage);
    }

    public CompositionOutcome compute(IndexConfig config, PriceSet prices, CalculationMethod method) {
        return compute(config, prices, method, null, null);
    }

    /**
     * @param minCoverage minimum fraction of configured weight that must be priced;
     *                    {@code null} selects the composer default
     * @param prior       previous period; required for {@link CalculationMethod#RETURN_BASED}
     * @throws ComputationException when no value can be produced
     */
    public CompositionOutcome compute(IndexConfig config,
                                      PriceSet prices,
                                      CalculationMethod method,
                                      BigDecimal minCoverage,
                                      PriorPeriod prior) {
        validator.validate(config);
        if (method == null) {
            throw new ComputationException(ComputationException.UNSUPPORTED_METHOD, "no calculation method supplied");
        }
        IndexCalculationStrategy strategy = strategies.get(method);
        if (strategy == null) {
            throw new ComputationException(ComputationException.UNSUPPORTED_METHOD,
                "calculation method " + method.wireName() + " is not available");
        }
        BigDecimal threshold = minCoverage == null ? defaultMinCoverage : checkThreshold(minCoverage);
        PriceSet current = prices == null ? PriceSet.empty() : prices;

        WeightedComputation computation = strategy.compute(config, current, prior);

        BigDecimal totalWeight = config.weights().values().stream()
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal coverage = computation.usedWeight()
            .divide(totalWeight, IndexCalculationStrategy.PRECISION)
            .stripTrailingZeros();
        if (coverage.compareTo(threshold) < 0) {
            throw ComputationException.insufficientCoverage(coverage, threshold);
        }

        BigDecimal value = computation.rawValue().setScale(VALUE_SCALE, RoundingMode.HALF_EVEN);
        return new CompositionOutcome(config, value, method, coverage,
            computation.symbolsUsed(), computation.symbolsMissing(), computation.pricesUsed(),
            method == CalculationMethod.RETURN_BASED ? prior : null);
    }

    private static BigDecimal checkThreshold(BigDecimal threshold) {
        if (threshold == null || threshold.signum() < 0 || threshold.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException(ValidationException.INVALID_THRESHOLD, null,
                "min coverage must be within [0, 1], got " + threshold);
        }
        return threshold;
    }
}
