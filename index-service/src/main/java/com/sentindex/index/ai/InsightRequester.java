package com.sentindex.index.ai;

import com.sentindex.common.exception.InsightUnavailableException;
import com.sentindex.common.model.InsightRequest;
import com.sentindex.common.model.InsightResult;
import com.sentindex.common.model.InsightSource;
import com.sentindex.index.config.IndexProperties;
import com.sentindex.index.metrics.IndexMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Best-effort narrative for an index value.
 *
 * <p>One bounded attempt per call: prompt, call the {@link ReasoningClient}, strict-parse the
 * answer. Any failure (timeout, transport, malformed or incomplete payload) yields
 * {@link InsightResult#degraded}. The returned {@code Mono} never errors and never completes empty.
 * Cancelling it cancels the in-flight call.
 */
@Service
public class InsightRequester {

    private static final Logger log = LoggerFactory.getLogger(InsightRequester.class);

    private final ReasoningClient reasoningClient;
    private final InsightPromptBuilder promptBuilder;
    private final InsightResponseParser responseParser;
    private final Clock clock;
    private final Duration defaultDeadline;
    private final IndexMetrics metrics;

    public InsightRequester(ReasoningClient reasoningClient,
                            InsightPromptBuilder promptBuilder,
                            InsightResponseParser responseParser,
                            Clock clock,
                            IndexProperties properties,
                            IndexMetrics metrics) {
        this.reasoningClient = reasoningClient;
        this.promptBuilder   = promptBuilder;
        this.responseParser  = responseParser;
        this.clock           = clock;
        this.defaultDeadline = Duration.ofMillis(properties.insights().deadlineMs());
        this.metrics         = metrics;
    }

    public Mono<InsightResult> request(InsightRequest request) {
        return request(request, defaultDeadline);
    }

    /**
     * One bounded attempt. A {@code null} deadline selects {@code sentindex.insights.deadline-ms}.
     */
    public Mono<InsightResult> request(InsightRequest request, Duration deadline) {
        Duration effective = deadline == null ? defaultDeadline : deadline;
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return Mono.fromCallable(() -> promptBuilder.build(request))
                .flatMap(prompt -> reasoningClient.complete(prompt, effective))
                .timeout(effective)
                .map(text -> responseParser.parse(text, clock.instant()))
                .doOnNext(r -> {
                    log.info("[Insight] Insight generated. index={} sentiment={} events={} risks={}",
                             request.indexName(), r.sentiment().wireName(),
                             r.notableEvents().size(), r.riskFactors().size());
                    metrics.insightCompleted(request.indexName(), InsightSource.AI, null, System.nanoTime() - start);
                })
                .onErrorResume(e -> {
                    String reason = IndexMetrics.reasonOf(e);
                    log.warn("[Insight] Reasoning attempt failed, returning fallback. index={} reason={} detail={}",
                             request.indexName(), reason, e.getMessage());
                    metrics.insightCompleted(request.indexName(), InsightSource.FALLBACK, reason,
                                             System.nanoTime() - start);
                    return Mono.just(InsightResult.degraded(clock.instant()));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("[Insight] Reasoning service returned nothing, returning fallback. index={}",
                             request.indexName());
                    metrics.insightCompleted(request.indexName(), InsightSource.FALLBACK,
                                             InsightUnavailableException.EMPTY_RESPONSE, System.nanoTime() - start);
                    return InsightResult.degraded(clock.instant());
                }));
        });
    }
}
