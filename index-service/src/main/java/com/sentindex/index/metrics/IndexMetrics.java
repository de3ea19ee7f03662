package com.sentindex.index.metrics;

import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.exception.IndexException;
import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.InsightSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Micrometer meters for the compute and insight paths, scraped from {@code /actuator/prometheus}.
 *
 * <ul>
 *   <li>{@code sentindex.index.computations} counter and {@code sentindex.index.computation.duration}
 *       timer, tagged {@code index_name}, {@code method}, {@code outcome} and {@code reason}</li>
 *   <li>{@code sentindex.insight.requests} counter and {@code sentindex.insight.duration} timer,
 *       tagged {@code index_name}, {@code source} and {@code reason}</li>
 * </ul>
 *
 * Requests for unregistered index names are tagged {@code index_name=unknown} to keep the tag
 * cardinality bounded by the configuration.
 */
@Component
public class IndexMetrics {

    public static final String COMPUTATIONS         = "sentindex.index.computations";
    public static final String COMPUTATION_DURATION = "sentindex.index.computation.duration";
    public static final String INSIGHT_REQUESTS     = "sentindex.insight.requests";
    public static final String INSIGHT_DURATION     = "sentindex.insight.duration";

    static final String NONE    = "none";
    static final String UNKNOWN = "unknown";

    private final MeterRegistry registry;

    public IndexMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void computationSucceeded(String indexName, CalculationMethod method, long nanos) {
        recordComputation(indexName, method.wireName(), "success", NONE, nanos);
    }

    public void computationFailed(String indexName, String rawMethod, Throwable error, long nanos) {
        String reason = reasonOf(error);
        String name = ComputationException.UNKNOWN_INDEX.equals(reason) || indexName == null ? UNKNOWN : indexName;
        recordComputation(name, methodTag(rawMethod), "rejected", reason, nanos);
    }

    public void insightCompleted(String indexName, InsightSource source, String reason, long nanos) {
        String name = indexName == null ? UNKNOWN : indexName;
        String sourceTag = source.wireName();
        Counter.builder(INSIGHT_REQUESTS)
            .description("Insight requests by outcome")
            .tags("index_name", name, "source", sourceTag, "reason", reason == null ? NONE : reason)
            .register(registry)
            .increment();
        Timer.builder(INSIGHT_DURATION)
            .description("Time spent producing an insight, including the reasoning call")
            .tags("index_name", name, "source", sourceTag)
            .publishPercentileHistogram()
            .register(registry)
            .record(nanos, TimeUnit.NANOSECONDS);
    }

    /** Reason token for a failure: the {@link IndexException} reason, or the exception type. */
    public static String reasonOf(Throwable error) {
        if (error instanceof IndexException ie) {
            return ie.getReason();
        }
        if (error instanceof TimeoutException) {
            return "timeout";
        }
        return error == null ? UNKNOWN : error.getClass().getSimpleName();
    }

    private void recordComputation(String indexName, String method, String outcome, String reason, long nanos) {
        Counter.builder(COMPUTATIONS)
            .description("Index computations by outcome")
            .tags("index_name", indexName, "method", method, "outcome", outcome, "reason", reason)
            .register(registry)
            .increment();
        Timer.builder(COMPUTATION_DURATION)
            .description("Time spent computing an index value")
            .tags("index_name", indexName, "method", method, "outcome", outcome)
            .publishPercentileHistogram()
            .register(registry)
            .record(nanos, TimeUnit.NANOSECONDS);
    }

    private static String methodTag(String rawMethod) {
        try {
            return CalculationMethod.fromWire(rawMethod).wireName();
        } catch (ComputationException e) {
            return "unsupported";
        }
    }
}
