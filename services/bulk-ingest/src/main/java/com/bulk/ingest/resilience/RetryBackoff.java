package com.bulk.ingest.resilience;

import java.time.Duration;

/**
 * Exponential backoff: {@code initial * 2^(attempt-1)}, capped at {@code max}.
 */
public class RetryBackoff {

    private final Duration initial;
    private final Duration max;

    public RetryBackoff(Duration initial, Duration max) {
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Invalid backoff bounds: initial=" + initial + ", max=" + max);
        }
        this.initial = initial;
        this.max = max;
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = initial.toMillis() << shift;
        if (millis < 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }

    public void sleepAfter(int attempt) throws InterruptedException {
        Duration delay = delayAfter(attempt);
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
