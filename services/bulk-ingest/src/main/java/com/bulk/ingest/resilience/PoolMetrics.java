package com.bulk.ingest.resilience;

/**
 * Point-in-time view of the database resource pool.
 */
public record PoolMetrics(
        int activeConnections,
        int idleConnections,
        int totalConnections,
        long queryCount,
        long errorCount,
        double averageLatencyMillis,
        CircuitBreaker.State circuitState) {
}
