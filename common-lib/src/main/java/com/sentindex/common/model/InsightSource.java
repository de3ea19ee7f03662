package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InsightSource {

    AI,
    FALLBACK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
