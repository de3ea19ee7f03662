package com.sentindex.index.controller;

import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.exception.ValidationException;
import com.sentindex.index.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps pipeline failures to {@code {error_kind, detail, reason, ...}} bodies:
 * validation errors to 400, computation errors to 422 and an unknown index to 404.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Rejected input. reason={} symbol={} detail={}", ex.getReason(), ex.getSymbol(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(ComputationException.class)
    public ResponseEntity<ErrorResponse> handleComputation(ComputationException ex) {
        HttpStatus status = ComputationException.UNKNOWN_INDEX.equals(ex.getReason())
            ? HttpStatus.NOT_FOUND
            : HttpStatus.UNPROCESSABLE_ENTITY;
        log.warn("Computation refused. status={} reason={} detail={}", status.value(), ex.getReason(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ValidationException.ERROR_KIND, "malformed_request",
                                   ex.getReason() == null ? "malformed request" : ex.getReason()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode())
            .body(ErrorResponse.of("http_error", "http_" + ex.getStatusCode().value(),
                                   ex.getReason() == null ? ex.getMessage() : ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("internal_error", "internal_error", "unexpected server error"));
    }
}
