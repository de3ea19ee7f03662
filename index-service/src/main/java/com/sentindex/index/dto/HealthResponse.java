package com.sentindex.index.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code GET /api/v1/index/health}. {@code status} is {@code DEGRADED} when history-service
 * is unreachable: computation still works but nothing is persisted and insights fall back.
 */
public record HealthResponse(
    @JsonProperty("status")           String status,
    @JsonProperty("reasoning_client") String reasoningClient,
    @JsonProperty("history_service")  String historyService
) {
    public static HealthResponse of(boolean reasoningEnabled, boolean historyUp) {
        return new HealthResponse(historyUp ? "OK" : "DEGRADED",
                                  reasoningEnabled ? "enabled" : "disabled",
                                  historyUp ? "up" : "down");
    }
}
