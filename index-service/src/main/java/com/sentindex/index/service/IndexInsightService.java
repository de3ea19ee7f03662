package com.sentindex.index.service;

import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.InsightRequest;
import com.sentindex.common.model.InsightResult;
import com.sentindex.common.model.PersistedIndexValue;
import com.sentindex.common.trace.TraceContextUtil;
import com.sentindex.index.ai.InsightRequester;
import com.sentindex.index.client.HistoryClient;
import com.sentindex.index.dto.InsightsResponse;
import com.sentindex.index.registry.IndexConfigRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Pairs an index name with its most recent persisted value and asks for an insight on it.
 * Without a persisted value there is nothing to describe, so the degraded insight is returned.
 */
@Service
public class IndexInsightService {

    private static final Logger log = LoggerFactory.getLogger(IndexInsightService.class);

    private final IndexConfigRegistry registry;
    private final HistoryClient historyClient;
    private final InsightRequester insightRequester;
    private final Clock clock;

    public IndexInsightService(IndexConfigRegistry registry,
                               HistoryClient historyClient,
                               InsightRequester insightRequester,
                               Clock clock) {
        this.registry         = registry;
        this.historyClient    = historyClient;
        this.insightRequester = insightRequester;
        this.clock            = clock;
    }

    /** @throws com.sentindex.common.exception.ComputationException {@code unknown_index} */
    public Mono<InsightsResponse> insights(String indexName) {
        IndexConfig config = registry.require(indexName);
        return Mono.deferContextual(ctx -> historyClient.fetchLatest(config.name())
            .flatMap(latest -> historyClient.fetchDelta24h(config.name())
                .map(delta -> Optional.ofNullable(delta.deltaPct()))
                .defaultIfEmpty(Optional.empty())
                .flatMap(delta -> insightRequester.request(toRequest(config, latest, delta.orElse(null)))))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("[Insight] No computed value to describe, returning fallback. index={} traceId={}",
                         config.name(), TraceContextUtil.getTraceId(ctx));
                return InsightResult.degraded(clock.instant());
            }))
            .map(insight -> new InsightsResponse(config.name(), insight, clock.instant())));
    }

    private static InsightRequest toRequest(IndexConfig config, PersistedIndexValue latest, BigDecimal delta) {
        return new InsightRequest(config.name(), latest.indexValue(), latest.toPriorPeriod().prices(), delta, config);
    }
}
