package com.sentindex.history.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentindex.common.delta.IndexDeltaCalculator;
import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexDelta;
import com.sentindex.common.model.IndexResult;
import com.sentindex.common.model.PersistedIndexValue;
import com.sentindex.common.model.ProvenanceRecord;
import com.sentindex.history.model.IndexValueRecord;
import com.sentindex.history.repository.IndexValueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-series collaborator of the index pipeline: appends one row per computation and
 * answers latest / range / 24h-delta reads.
 *
 * <p>Rows are never updated. A second save for the same {@code (time, index_name)} fails
 * with {@link DuplicateIndexValueException}.
 */
@Service
public class IndexHistoryService {

    private static final Logger log = LoggerFactory.getLogger(IndexHistoryService.class);

    static final Duration DELTA_WINDOW = Duration.ofHours(24);
    static final int MAX_HISTORY_LIMIT = 10_000;

    private final IndexValueRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IndexHistoryService(IndexValueRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    public Mono<PersistedIndexValue> save(IndexResult result) {
        return repository.existsByIndexNameAndTime(result.indexName(), result.timestamp())
            .flatMap(exists -> exists
                ? Mono.<IndexValueRecord>error(new DuplicateIndexValueException(result.indexName(), result.timestamp()))
                : Mono.fromCallable(() -> toEntity(result)).flatMap(repository::save))
            .onErrorMap(DataIntegrityViolationException.class,
                        e -> new DuplicateIndexValueException(result.indexName(), result.timestamp()))
            .map(this::toDto)
            .doOnSuccess(saved -> log.info("Index value persisted. index={} value={} method={} time={}",
                                           saved.indexName(), saved.indexValue(),
                                           saved.method().wireName(), saved.time()))
            .doOnError(e -> log.error("Failed to persist index value. index={} time={}",
                                      result.indexName(), result.timestamp(), e));
    }

    public Mono<PersistedIndexValue> latest(String indexName) {
        return repository.findFirstByIndexNameOrderByTimeDesc(indexName).map(this::toDto);
    }

    /**
     * @param start inclusive; {@code null} means from the beginning
     * @param end   inclusive; {@code null} means now
     * @param limit capped at {@value #MAX_HISTORY_LIMIT}
     */
    public Flux<PersistedIndexValue> history(String indexName, Instant start, Instant end, int limit) {
        Instant from = start != null ? start : Instant.EPOCH;
        Instant to   = end   != null ? end   : clock.instant();
        int capped   = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return repository.findHistory(indexName, from, to, capped).map(this::toDto);
    }

    /** Latest value against the newest value at or before {@code latest.time − 24h}. */
    public Mono<IndexDelta> delta24h(String indexName) {
        return repository.findFirstByIndexNameOrderByTimeDesc(indexName)
            .flatMap(latest -> repository
                .findFirstByIndexNameAndTimeLessThanEqualOrderByTimeDesc(indexName, latest.getTime().minus(DELTA_WINDOW))
                .map(previous -> new IndexDelta(indexName, latest.getIndexValue(), latest.getTime(),
                    previous.getIndexValue(), previous.getTime(),
                    IndexDeltaCalculator.deltaPct(latest.getIndexValue(), previous.getIndexValue())))
                .defaultIfEmpty(new IndexDelta(indexName, latest.getIndexValue(), latest.getTime(),
                    null, null, null)));
    }

    private IndexValueRecord toEntity(IndexResult result) throws JsonProcessingException {
        IndexValueRecord entity = new IndexValueRecord();
        entity.setTime(result.timestamp());
        entity.setIndexName(result.indexName());
        entity.setIndexValue(result.value());
        entity.setMethod(result.method().wireName());
        entity.setCoverageRatio(result.coverageRatio());
        entity.setPayload(objectMapper.writeValueAsString(result.provenance()));
        entity.setSavedAt(clock.instant());
        return entity;
    }

    private PersistedIndexValue toDto(IndexValueRecord entity) {
        ProvenanceRecord payload = null;
        if (entity.getPayload() != null) {
            try {
                payload = objectMapper.readValue(entity.getPayload(), ProvenanceRecord.class);
            } catch (JsonProcessingException e) {
                log.warn("Unreadable provenance payload. index={} time={} reason={}",
                         entity.getIndexName(), entity.getTime(), e.getOriginalMessage());
            }
        }
        return new PersistedIndexValue(entity.getTime(), entity.getIndexName(), entity.getIndexValue(),
            CalculationMethod.fromWire(entity.getMethod()), entity.getCoverageRatio(), payload);
    }
}
