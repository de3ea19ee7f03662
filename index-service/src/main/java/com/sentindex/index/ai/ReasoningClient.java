package com.sentindex.index.ai;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Black-box text completion: submit a prompt, get the raw answer text.
 *
 * <p>Implementations signal every failure (timeout, non-2xx, transport error, empty answer) as an
 * error of the returned {@code Mono}, typically an
 * {@link com.sentindex.common.exception.InsightUnavailableException}. Cancelling the subscription
 * must release the in-flight call.
 */
@FunctionalInterface
public interface ReasoningClient {

    Mono<String> complete(String prompt, Duration deadline);

    /** {@code false} when every call is known to fail without leaving the process. */
    default boolean enabled() {
        return true;
    }
}
