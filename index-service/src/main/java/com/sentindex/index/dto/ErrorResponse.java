package com.sentindex.index.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.exception.IndexException;
import com.sentindex.common.exception.ValidationException;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error_kind")     String errorKind,
    @JsonProperty("detail")         String detail,
    @JsonProperty("reason")         String reason,
    @JsonProperty("symbol")         String symbol,
    @JsonProperty("coverage_ratio") BigDecimal coverageRatio
) {
    public static ErrorResponse from(IndexException e) {
        String symbol = e instanceof ValidationException ve ? ve.getSymbol() : null;
        BigDecimal coverage = e instanceof ComputationException ce ? ce.getCoverageRatio() : null;
        return new ErrorResponse(e.getErrorKind(), e.getMessage(), e.getReason(), symbol, coverage);
    }

    public static ErrorResponse of(String errorKind, String reason, String detail) {
        return new ErrorResponse(errorKind, detail, reason, null, null);
    }
}
