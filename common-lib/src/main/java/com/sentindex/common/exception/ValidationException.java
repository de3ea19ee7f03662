package com.sentindex.common.exception;

/**
 * Malformed input rejected before any computation runs (ValidationError).
 */
public class ValidationException extends IndexException {

    public static final String ERROR_KIND = "validation_error";

    public static final String NON_POSITIVE_PRICE = "non_positive_price";
    public static final String MISSING_PRICE      = "missing_price";
    public static final String BLANK_SYMBOL       = "blank_symbol";
    public static final String INVALID_THRESHOLD  = "invalid_min_coverage";

    private final String symbol;

    public ValidationException(String reason, String symbol, String message) {
        super(reason, message);
        this.symbol = symbol;
    }

    public static ValidationException nonPositivePrice(String symbol, Object value) {
        return new ValidationException(NON_POSITIVE_PRICE, symbol,
            "price for " + symbol + " must be a finite value > 0, got " + value);
    }

    /** Offending symbol, or {@code null} when the failure is not tied to one. */
    public String getSymbol() {
        return symbol;
    }

    @Override
    public String getErrorKind() {
        return ERROR_KIND;
    }
}
