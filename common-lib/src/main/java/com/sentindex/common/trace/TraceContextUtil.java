package com.sentindex.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a request's {@code traceId} through reactive pipelines.
 *
 * <p>The Reactor Context is the source of truth. MDC is written only for the duration of a
 * single log statement via {@link #withMdc}, never left behind on a pooled thread.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Returns {@code headerValue} when present, otherwise a fresh random id. */
    public static String resolve(String headerValue) {
        return headerValue == null || headerValue.isBlank() ? UUID.randomUUID().toString() : headerValue.trim();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the traceId stored in {@code ctx}, or {@code "unknown"} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
