package com.sentindex.common.exception;

import java.math.BigDecimal;

/**
 * The composer refused to produce a value (ComputationError). No partial result exists
 * when this is thrown.
 */
public class ComputationException extends IndexException {

    public static final String ERROR_KIND = "computation_error";

    public static final String MISSING_CONFIG        = "missing_config";
    public static final String UNKNOWN_INDEX         = "unknown_index";
    public static final String INVALID_CONFIG        = "invalid_config";
    public static final String UNSUPPORTED_METHOD    = "unsupported_method";
    public static final String ZERO_SUM_WEIGHTS      = "zero_sum_weights";
    public static final String INSUFFICIENT_COVERAGE = "insufficient_coverage";
    public static final String NO_PRIOR_PERIOD       = "no_prior_period";

    private final BigDecimal coverageRatio;

    public ComputationException(String reason, String message) {
        this(reason, message, (BigDecimal) null);
    }

    public ComputationException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
        this.coverageRatio = null;
    }

    public ComputationException(String reason, String message, BigDecimal coverageRatio) {
        super(reason, message);
        this.coverageRatio = coverageRatio;
    }

    public static ComputationException insufficientCoverage(BigDecimal coverageRatio, BigDecimal threshold) {
        return new ComputationException(INSUFFICIENT_COVERAGE,
            "coverage " + coverageRatio.toPlainString() + " is below threshold " + threshold.toPlainString(),
            coverageRatio);
    }

    /** Only set for {@link #INSUFFICIENT_COVERAGE}. */
    public BigDecimal getCoverageRatio() {
        return coverageRatio;
    }

    @Override
    public String getErrorKind() {
        return ERROR_KIND;
    }
}
