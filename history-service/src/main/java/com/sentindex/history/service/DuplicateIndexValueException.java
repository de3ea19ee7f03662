package com.sentindex.history.service;

import java.time.Instant;

public class DuplicateIndexValueException extends RuntimeException {

    public DuplicateIndexValueException(String indexName, Instant time) {
        super("index value already stored. index=" + indexName + " time=" + time);
    }
}
