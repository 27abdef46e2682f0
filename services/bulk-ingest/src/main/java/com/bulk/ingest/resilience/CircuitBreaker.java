package com.bulk.ingest.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import lombok.extern.slf4j.Slf4j;

/**
 * Consecutive-failure circuit breaker for one protected resource.
 *
 * <p>CLOSED: calls pass; {@code failureThreshold} consecutive failures open the circuit.
 * OPEN: calls fail fast with {@link CircuitOpenException} until {@code coolDown} elapses.
 * HALF_OPEN: exactly one probe call is admitted; success closes the circuit, failure re-opens it.
 *
 * <p>State is shared by every caller in the process.
 */
@Slf4j
public class CircuitBreaker {

    public enum State {
        CLOSED, OPEN, HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration coolDown;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean probeInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration coolDown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    /**
     * Admits a call or throws {@link CircuitOpenException}.
     * Every admitted call must be followed by {@link #onSuccess()} or {@link #onFailure()}.
     */
    public synchronized void acquirePermission() {
        if (state == State.OPEN) {
            Duration remaining = remainingCoolDown();
            if (!remaining.isZero()) {
                throw new CircuitOpenException(name, remaining);
            }
            transitionTo(State.HALF_OPEN);
        }
        if (state == State.HALF_OPEN) {
            if (probeInFlight) {
                throw new CircuitOpenException(name, coolDown);
            }
            probeInFlight = true;
        }
    }

    public synchronized void onSuccess() {
        consecutiveFailures = 0;
        if (state == State.HALF_OPEN) {
            probeInFlight = false;
            transitionTo(State.CLOSED);
        }
    }

    public synchronized void onFailure() {
        consecutiveFailures++;
        if (state == State.HALF_OPEN) {
            probeInFlight = false;
            open();
        } else if (state == State.CLOSED && consecutiveFailures >= failureThreshold) {
            open();
        }
    }

    /**
     * Releases an admitted call that ended with an outcome saying nothing about the resource's health.
     */
    public synchronized void onIgnored() {
        if (state == State.HALF_OPEN) {
            probeInFlight = false;
        }
    }

    public synchronized State getState() {
        if (state == State.OPEN && remainingCoolDown().isZero()) {
            return State.HALF_OPEN;
        }
        return state;
    }

    /**
     * Time until an open circuit admits a probe; zero unless the circuit is open.
     */
    public synchronized Duration getRetryAfter() {
        return state == State.OPEN ? remainingCoolDown() : Duration.ZERO;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant getOpenedAt() {
        return openedAt;
    }

    public String getName() {
        return name;
    }

    private void open() {
        openedAt = clock.instant();
        transitionTo(State.OPEN);
    }

    private Duration remainingCoolDown() {
        Duration elapsed = Duration.between(openedAt, clock.instant());
        Duration remaining = coolDown.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void transitionTo(State next) {
        if (state == next) {
            return;
        }
        State previous = state;
        state = next;
        if (next == State.OPEN) {
            log.warn("Circuit breaker '{}' {} -> OPEN after {} consecutive failures", name, previous, consecutiveFailures);
        } else {
            log.info("Circuit breaker '{}' {} -> {}", name, previous, next);
        }
        if (next == State.CLOSED) {
            openedAt = null;
        }
    }
}
