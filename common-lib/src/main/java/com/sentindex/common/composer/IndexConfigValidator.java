package com.sentindex.common.composer;

import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.model.IndexConfig;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Checks the structural invariants of an {@link IndexConfig} before it is used.
 *
 * <ul>
 *   <li>a non-blank name and a positive base level</li>
 *   <li>{@code weights} and {@code basePrices} share the same key set</li>
 *   <li>every weight is strictly positive and the weights sum to 1 within {@code tolerance}</li>
 *   <li>every base price is strictly positive</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public class IndexConfigValidator {

    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.000001");

    private final BigDecimal tolerance;

    public IndexConfigValidator() {
        this(DEFAULT_TOLERANCE);
    }

    public IndexConfigValidator(BigDecimal tolerance) {
        if (tolerance == null || tolerance.signum() < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        this.tolerance = tolerance;
    }

    /**
     * @throws ComputationException {@code missing_config}, {@code zero_sum_weights} or {@code invalid_config}
     */
    public void validate(IndexConfig config) {
        if (config == null) {
            throw new ComputationException(ComputationException.MISSING_CONFIG, "no index configuration supplied");
        }
        String name = config.name();
        if (name == null || name.isBlank()) {
            throw invalid(name, "name is blank");
        }
        if (config.baseLevel() == null || config.baseLevel().signum() <= 0) {
            throw invalid(name, "base_level must be > 0");
        }

        BigDecimal weightSum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> w : config.weights().entrySet()) {
            BigDecimal weight = w.getValue();
            if (weight == null || weight.signum() < 0) {
                throw invalid(name, "weight for " + w.getKey() + " must be > 0");
            }
            weightSum = weightSum.add(weight);
        }
        if (weightSum.signum() == 0) {
            throw new ComputationException(ComputationException.ZERO_SUM_WEIGHTS,
                "weights of index '" + name + "' sum to zero");
        }
        for (Map.Entry<String, BigDecimal> w : config.weights().entrySet()) {
            if (w.getValue().signum() == 0) {
                throw invalid(name, "weight for " + w.getKey() + " must be > 0");
            }
        }
        if (weightSum.subtract(BigDecimal.ONE).abs().compareTo(tolerance) > 0) {
            throw invalid(name, "weights must sum to 1, got " + weightSum.toPlainString());
        }

        if (!config.weights().keySet().equals(config.basePrices().keySet())) {
            throw invalid(name, "weights " + config.weights().keySet()
                + " and base_prices " + config.basePrices().keySet() + " cover different symbols");
        }
        for (Map.Entry<String, BigDecimal> b : config.basePrices().entrySet()) {
            if (b.getValue() == null || b.getValue().signum() <= 0) {
                throw invalid(name, "base price for " + b.getKey() + " must be > 0");
            }
        }
    }

    private static ComputationException invalid(String name, String detail) {
        return new ComputationException(ComputationException.INVALID_CONFIG,
            "index '" + name + "': " + detail);
    }
}
