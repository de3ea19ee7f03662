package com.sentindex.index.health;

import com.sentindex.index.client.HistoryClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class HistoryServiceHealthIndicator implements ReactiveHealthIndicator {

    private final HistoryClient historyClient;

    public HistoryServiceHealthIndicator(HistoryClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public Mono<Health> health() {
        return historyClient.ping()
            .map(up -> up ? Health.up().build() : Health.down().withDetail("reason", "unreachable").build());
    }
}
