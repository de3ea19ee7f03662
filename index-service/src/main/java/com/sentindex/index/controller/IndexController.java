package com.sentindex.index.controller;

import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.IndexResult;
import com.sentindex.common.trace.TraceContextUtil;
import com.sentindex.index.ai.ReasoningClient;
import com.sentindex.index.client.HistoryClient;
import com.sentindex.index.dto.ComputeRequest;
import com.sentindex.index.dto.HealthResponse;
import com.sentindex.index.dto.InsightsResponse;
import com.sentindex.index.dto.LatestIndexResponse;
import com.sentindex.index.registry.IndexConfigRegistry;
import com.sentindex.index.service.IndexComputationService;
import com.sentindex.index.service.IndexInsightService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/index")
public class IndexController {

    private static final Logger log = LoggerFactory.getLogger(IndexController.class);

    private final IndexComputationService computationService;
    private final IndexInsightService insightService;
    private final IndexConfigRegistry registry;
    private final ReasoningClient reasoningClient;
    private final HistoryClient historyClient;

    public IndexController(IndexComputationService computationService,
                           IndexInsightService insightService,
                           IndexConfigRegistry registry,
                           ReasoningClient reasoningClient,
                           HistoryClient historyClient) {
        this.computationService = computationService;
        this.insightService     = insightService;
        this.registry           = registry;
        this.reasoningClient    = reasoningClient;
        this.historyClient      = historyClient;
    }

    @PostMapping("/compute")
    public Mono<ResponseEntity<IndexResult>> compute(
            @RequestBody ComputeRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        TraceContextUtil.withMdc(traceId, () ->
            log.info("Compute requested. index={} method={} symbols={}",
                     request.indexName(), request.method(),
                     request.prices() == null ? 0 : request.prices().size()));
        return TraceContextUtil.withTraceId(computationService.compute(request), traceId)
            .map(result -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(result));
    }

    @GetMapping("/{name}/insights")
    public Mono<ResponseEntity<InsightsResponse>> insights(
            @PathVariable String name,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return TraceContextUtil.withTraceId(insightService.insights(name), traceId)
            .map(response -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(response));
    }

    @GetMapping("/{name}/latest")
    public Mono<ResponseEntity<LatestIndexResponse>> latest(@PathVariable String name) {
        return computationService.latest(name)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/configs")
    public ResponseEntity<List<IndexConfig>> configs() {
        return ResponseEntity.ok(List.copyOf(registry.all()));
    }

    @GetMapping("/configs/{name}")
    public ResponseEntity<IndexConfig> config(@PathVariable String name) {
        return ResponseEntity.ok(registry.require(name));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        return historyClient.ping()
            .map(historyUp -> ResponseEntity.ok(HealthResponse.of(reasoningClient.enabled(), historyUp)));
    }
}
