package com.sentindex.index.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentindex.common.model.InsightResult;

import java.time.Instant;

public record InsightsResponse(
    @JsonProperty("index_name") String indexName,
    @JsonProperty("insights")   InsightResult insights,
    @JsonProperty("timestamp")  Instant timestamp
) {}
