package com.sentindex.index.health;

import com.sentindex.index.ai.ReasoningClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether insights can reach the reasoning service. A disabled client stays {@code UP}
 * since every insight call still answers, with the fallback narrative.
 */
@Component
public class ReasoningClientHealthIndicator implements HealthIndicator {

    private final ReasoningClient reasoningClient;

    public ReasoningClientHealthIndicator(ReasoningClient reasoningClient) {
        this.reasoningClient = reasoningClient;
    }

    @Override
    public Health health() {
        return Health.up()
            .withDetail("state", reasoningClient.enabled() ? "enabled" : "disabled")
            .build();
    }
}
