package com.sentindex.common.publish;

import com.sentindex.common.model.IndexResult;

/**
 * Hands a computed {@link IndexResult} to the time-series collaborator for persistence.
 *
 * <p>Implementations MUST be non-blocking (fire-and-forget or fully reactive) and must never
 * let a persistence failure reach the caller that computed the value.
 */
public interface IndexResultPublisher {

    /**
     * @param traceId correlation id of the computing request, forwarded to the persistence side;
     *                may be {@code null}
     */
    void publish(IndexResult result, String traceId);
}
