package com.sentindex.index.publisher;

import com.sentindex.common.model.IndexResult;
import com.sentindex.common.publish.IndexResultPublisher;
import com.sentindex.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends each computed {@link IndexResult} to history-service via HTTP POST (fire-and-forget),
 * carrying the request's trace id in {@code X-Trace-Id}.
 * A failed save is logged and otherwise ignored; the computed value has already been returned.
 */
@Component
public class RestIndexResultPublisher implements IndexResultPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestIndexResultPublisher.class);

    private final WebClient historyClient;

    public RestIndexResultPublisher(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public void publish(IndexResult result, String traceId) {
        historyClient.post()
            .uri("/api/v1/history/index/save")
            .headers(h -> {
                if (traceId != null) {
                    h.set(TraceContextUtil.TRACE_ID_HEADER, traceId);
                }
            })
            .bodyValue(result)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Index value published. index={} value={} status={} traceId={}",
                                result.indexName(), result.value(), r.getStatusCode(), traceId),
                err -> log.warn("Index value publish failed (non-critical). index={} time={} traceId={}",
                                result.indexName(), result.timestamp(), traceId, err)
            );
    }
}
