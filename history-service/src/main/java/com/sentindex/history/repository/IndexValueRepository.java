package com.sentindex.history.repository;

import com.sentindex.history.model.IndexValueRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface IndexValueRepository extends ReactiveCrudRepository<IndexValueRecord, Long> {

    Mono<IndexValueRecord> findFirstByIndexNameOrderByTimeDesc(String indexName);

    /** Newest row at or before {@code time}; the 24h comparison point. */
    Mono<IndexValueRecord> findFirstByIndexNameAndTimeLessThanEqualOrderByTimeDesc(String indexName, Instant time);

    Mono<Boolean> existsByIndexNameAndTime(String indexName, Instant time);

    @Query("""
        SELECT * FROM index_values
        WHERE index_name = :indexName
          AND time >= :start
          AND time <= :end
        ORDER BY time DESC
        LIMIT :limit
        """)
    Flux<IndexValueRecord> findHistory(String indexName, Instant start, Instant end, int limit);
}
