package com.sentindex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Structured narrative about an index value. Always produced: when the reasoning service is
 * unavailable or answers with an invalid payload, {@link #degraded(Instant)} stands in.
 */
public record InsightResult(
    @JsonProperty("sentiment")      Sentiment sentiment,
    @JsonProperty("summary")        String summary,
    @JsonProperty("notable_events") List<String> notableEvents,
    @JsonProperty("risk_factors")   List<String> riskFactors,
    @JsonProperty("source")         InsightSource source,
    @JsonProperty("generated_at")   Instant generatedAt
) {
    public static final String DEGRADED_SUMMARY = "insight unavailable";

    public InsightResult {
        notableEvents = notableEvents == null ? List.of() : List.copyOf(notableEvents);
        riskFactors   = riskFactors   == null ? List.of() : List.copyOf(riskFactors);
    }

    public static InsightResult degraded(Instant generatedAt) {
        return new InsightResult(Sentiment.UNKNOWN, DEGRADED_SUMMARY, List.of(), List.of(),
                                 InsightSource.FALLBACK, generatedAt);
    }
}
