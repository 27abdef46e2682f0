package com.bulk.ingest.resilience;

import java.time.Duration;

import lombok.Getter;

/**
 * Thrown when a call is rejected because the protecting circuit breaker is open.
 * Callers should back off for {@link #getRetryAfter()} instead of retrying immediately.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String resource;
    private final Duration retryAfter;

    public CircuitOpenException(String resource, Duration retryAfter) {
        super("Circuit breaker is open for " + resource + ", retry after " + retryAfter.toMillis() + "ms");
        this.resource = resource;
        this.retryAfter = retryAfter;
    }
}
