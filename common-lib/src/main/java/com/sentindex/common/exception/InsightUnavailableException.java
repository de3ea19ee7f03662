package com.sentindex.common.exception;

/**
 * The reasoning service could not produce a trustworthy insight. Never surfaced to callers:
 * the insight requester converts it into a degraded result.
 */
public class InsightUnavailableException extends IndexException {

    public static final String ERROR_KIND = "insight_unavailable";

    public static final String DISABLED           = "disabled";
    public static final String TIMEOUT            = "timeout";
    public static final String HTTP_STATUS        = "http_status";
    public static final String TRANSPORT_ERROR    = "transport_error";
    public static final String EMPTY_RESPONSE     = "empty_response";
    public static final String MALFORMED_RESPONSE = "malformed_response";
    public static final String MISSING_FIELD      = "missing_field";
    public static final String INVALID_FIELD      = "invalid_field";

    public InsightUnavailableException(String reason, String message) {
        super(reason, message);
    }

    public InsightUnavailableException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }

    @Override
    public String getErrorKind() {
        return ERROR_KIND;
    }
}
