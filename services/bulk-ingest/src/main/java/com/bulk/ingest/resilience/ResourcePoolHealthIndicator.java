package com.bulk.ingest.resilience;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

@Component("resourcePool")
@RequiredArgsConstructor
public class ResourcePoolHealthIndicator implements HealthIndicator {

    private final ResourcePoolManager resourcePoolManager;

    @Override
    public Health health() {
        PoolMetrics metrics = resourcePoolManager.metrics();
        Health.Builder builder = metrics.circuitState() == CircuitBreaker.State.OPEN
                ? Health.outOfService()
                : resourcePoolManager.probe() ? Health.up() : Health.down();
        return builder
                .withDetail("circuit", metrics.circuitState())
                .withDetail("active", metrics.activeConnections())
                .withDetail("idle", metrics.idleConnections())
                .withDetail("queries", metrics.queryCount())
                .withDetail("errors", metrics.errorCount())
                .withDetail("avgLatencyMs", metrics.averageLatencyMillis())
                .build();
    }
}
