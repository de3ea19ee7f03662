package com.sentindex.index.client;

import com.sentindex.common.model.IndexDelta;
import com.sentindex.common.model.PersistedIndexValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reads from history-service. Each call is bounded by {@code services.history.timeout-ms};
 * a missing row, a timeout or any transport failure completes empty so callers decide the
 * fallback.
 */
@Component
public class HistoryClient {

    private static final Logger log = LoggerFactory.getLogger(HistoryClient.class);

    private final WebClient historyClient;
    private final Duration timeout;

    public HistoryClient(WebClient historyClient,
                         @Value("${services.history.timeout-ms:2000}") long timeoutMs) {
        this.historyClient = historyClient;
        this.timeout       = Duration.ofMillis(timeoutMs);
    }

    public Mono<PersistedIndexValue> fetchLatest(String indexName) {
        return historyClient.get()
            .uri("/api/v1/history/index/{name}/latest", indexName)
            .retrieve()
            .bodyToMono(PersistedIndexValue.class)
            .timeout(timeout)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.debug("No persisted value yet. index={}", indexName);
                return Mono.empty();
            })
            .onErrorResume(e -> {
                log.warn("Failed to fetch latest index value from history-service. index={} reason={}",
                         indexName, e.getMessage());
                return Mono.empty();
            });
    }

    public Mono<IndexDelta> fetchDelta24h(String indexName) {
        return historyClient.get()
            .uri("/api/v1/history/index/{name}/delta-24h", indexName)
            .retrieve()
            .bodyToMono(IndexDelta.class)
            .timeout(timeout)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
            .onErrorResume(e -> {
                log.warn("Failed to fetch 24h delta from history-service. index={} reason={}",
                         indexName, e.getMessage());
                return Mono.empty();
            });
    }

    /** Emits {@code true} when history-service answers its health endpoint with a 2xx in time. */
    public Mono<Boolean> ping() {
        return historyClient.get()
            .uri("/api/v1/history/index/health")
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .timeout(timeout)
            .onErrorResume(e -> {
                log.debug("history-service health check failed. reason={}", e.getMessage());
                return Mono.just(false);
            })
            .defaultIfEmpty(false);
    }
}
