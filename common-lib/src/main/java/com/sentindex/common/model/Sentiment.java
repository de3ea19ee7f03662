package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall market tone reported by an insight. {@code UNKNOWN} is reserved for degraded results.
 */
public enum Sentiment {

    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
