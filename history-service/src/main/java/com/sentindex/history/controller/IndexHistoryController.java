package com.sentindex.history.controller;

import com.sentindex.common.model.IndexDelta;
import com.sentindex.common.model.IndexResult;
import com.sentindex.common.model.PersistedIndexValue;
import com.sentindex.common.trace.TraceContextUtil;
import com.sentindex.history.service.DuplicateIndexValueException;
import com.sentindex.history.service.IndexHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/history/index")
public class IndexHistoryController {

    private static final Logger log = LoggerFactory.getLogger(IndexHistoryController.class);

    private final IndexHistoryService historyService;

    public IndexHistoryController(IndexHistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping("/save")
    public Mono<ResponseEntity<PersistedIndexValue>> save(
            @RequestBody IndexResult result,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceId) {
        log.info("Received index value for persistence. index={} value={} time={} traceId={}",
                 result.indexName(), result.value(), result.timestamp(), traceId);
        return historyService.save(result)
            .map(saved -> ResponseEntity.status(HttpStatus.CREATED).body(saved))
            .onErrorResume(DuplicateIndexValueException.class,
                e -> Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).<PersistedIndexValue>build()));
    }

    @GetMapping("/{name}/latest")
    public Mono<ResponseEntity<PersistedIndexValue>> latest(@PathVariable String name) {
        log.info("Latest index value requested. index={}", name);
        return historyService.latest(name)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Latest endpoint error. index={}", name, e));
    }

    @GetMapping("/{name}/history")
    public Flux<PersistedIndexValue> history(
            @PathVariable String name,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "1000") int limit) {
        log.info("Index history requested. index={} start={} end={} limit={}", name, start, end, limit);
        return historyService.history(name, start, end, limit);
    }

    @GetMapping("/{name}/delta-24h")
    public Mono<ResponseEntity<IndexDelta>> delta24h(@PathVariable String name) {
        log.info("24h delta requested. index={}", name);
        return historyService.delta24h(name)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
