package com.sentindex.common.exception;

/**
 * Base of every failure the index pipeline reports to its immediate caller.
 *
 * <p>{@code reason} is a stable, machine-readable token (e.g. {@code non_positive_price},
 * {@code insufficient_coverage}) so callers can distinguish failure classes without
 * parsing messages. {@code errorKind} names the failure family.
 */
public abstract class IndexException extends RuntimeException {

    private final String reason;

    protected IndexException(String reason, String message) {
        super("[" + reason + "] " + message);
        this.reason = reason;
    }

    protected IndexException(String reason, String message, Throwable cause) {
        super("[" + reason + "] " + message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public abstract String getErrorKind();
}
