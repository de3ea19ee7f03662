package com.sentindex.index.ai;

import com.sentindex.common.exception.InsightUnavailableException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/** Wired when no API key is configured; every call fails fast. */
public class DisabledReasoningClient implements ReasoningClient {

    @Override
    public Mono<String> complete(String prompt, Duration deadline) {
        return Mono.error(new InsightUnavailableException(InsightUnavailableException.DISABLED,
            "reasoning service is not configured"));
    }

    @Override
    public boolean enabled() {
        return false;
    }
}
