package com.sentindex.index.service;

import com.sentindex.common.composer.CompositionOutcome;
import com.sentindex.common.composer.IndexComposer;
import com.sentindex.common.exception.IndexException;
import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.IndexResult;
import com.sentindex.common.model.PriceSet;
import com.sentindex.common.model.PriorPeriod;
import com.sentindex.common.normalize.PriceNormalizer;
import com.sentindex.common.provenance.ProvenanceRecorder;
import com.sentindex.common.publish.IndexResultPublisher;
import com.sentindex.common.trace.TraceContextUtil;
import com.sentindex.index.client.HistoryClient;
import com.sentindex.index.dto.ComputeRequest;
import com.sentindex.index.dto.LatestIndexResponse;
import com.sentindex.index.metrics.IndexMetrics;
import com.sentindex.index.registry.IndexConfigRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Request-level orchestration of a computation: resolve the configuration, normalize the prices,
 * resolve the prior period when the method needs one, compose, record provenance, then hand the
 * result to the publisher.
 *
 * <p>Everything except the prior-period fetch is synchronous CPU work. Validation and computation
 * failures are signalled as errors of the returned {@code Mono}; publishing never fails a call.
 * Every call, accepted or rejected, is counted and timed through {@link IndexMetrics}.
 */
@Service
public class IndexComputationService {

    private static final Logger log = LoggerFactory.getLogger(IndexComputationService.class);

    private final IndexConfigRegistry registry;
    private final PriceNormalizer normalizer;
    private final IndexComposer composer;
    private final ProvenanceRecorder recorder;
    private final HistoryClient historyClient;
    private final IndexResultPublisher publisher;
    private final IndexMetrics metrics;

    public IndexComputationService(IndexConfigRegistry registry,
                                   PriceNormalizer normalizer,
                                   IndexComposer composer,
                                   ProvenanceRecorder recorder,
                                   HistoryClient historyClient,
                                   IndexResultPublisher publisher,
                                   IndexMetrics metrics) {
        this.registry      = registry;
        this.normalizer    = normalizer;
        this.composer      = composer;
        this.recorder      = recorder;
        this.historyClient = historyClient;
        this.publisher     = publisher;
        this.metrics       = metrics;
    }

    public Mono<IndexResult> compute(ComputeRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            long start = System.nanoTime();
            return Mono.defer(() -> computeTraced(request, traceId))
                .doOnNext(result -> metrics.computationSucceeded(result.indexName(), result.method(),
                                                                 System.nanoTime() - start))
                .doOnError(e -> metrics.computationFailed(request.indexName(), request.method(), e,
                                                          System.nanoTime() - start));
        });
    }

    private Mono<IndexResult> computeTraced(ComputeRequest request, String traceId) {
        IndexConfig config = registry.require(request.indexName());
        CalculationMethod method = CalculationMethod.fromWire(request.method());
        PriceSet prices = normalizer.normalize(request.prices());

        return resolvePrior(config, method, request)
            .map(prior -> {
                CompositionOutcome outcome = composer.compute(config, prices, method,
                                                              request.minCoverage(), prior.orElse(null));
                return recorder.attach(outcome, prices);
            })
            .doOnNext(result -> {
                log.info("[IndexCompute] Index computed. index={} value={} method={} coverage={} missing={} traceId={}",
                         result.indexName(), result.value(), result.method().wireName(),
                         result.coverageRatio(), result.provenance().symbolsMissing(), traceId);
                publisher.publish(result, traceId);
            })
            .doOnError(IndexException.class,
                e -> log.warn("[IndexCompute] Computation rejected. index={} kind={} reason={} traceId={}",
                              config.name(), e.getErrorKind(), e.getReason(), traceId));
    }

    /**
     * Latest persisted value with its 24h change. Completes empty when nothing has been
     * persisted for the index yet.
     */
    public Mono<LatestIndexResponse> latest(String indexName) {
        IndexConfig config = registry.require(indexName);
        return historyClient.fetchLatest(config.name())
            .flatMap(latest -> historyClient.fetchDelta24h(config.name())
                .map(delta -> Optional.ofNullable(delta.deltaPct()))
                .defaultIfEmpty(Optional.empty())
                .map(delta -> LatestIndexResponse.of(latest, delta.orElse(null))));
    }

    private Mono<Optional<PriorPeriod>> resolvePrior(IndexConfig config, CalculationMethod method,
                                                     ComputeRequest request) {
        if (method != CalculationMethod.RETURN_BASED) {
            return Mono.just(Optional.empty());
        }
        if (request.prevPrices() != null && request.prevIndexLevel() != null) {
            PriceSet previous = normalizer.normalize(request.prevPrices(), config.weights().keySet());
            return Mono.just(Optional.of(PriorPeriod.of(previous, request.prevIndexLevel())));
        }
        return historyClient.fetchLatest(config.name())
            .map(latest -> {
                log.debug("Using persisted value as prior period. index={} time={} value={}",
                          config.name(), latest.time(), latest.indexValue());
                return Optional.of(latest.toPriorPeriod());
            })
            .defaultIfEmpty(Optional.empty());
    }
}
