package com.bulk.ingest.broker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Queue payload for one upload job. {@code attempt} starts at 1; a redelivery scheduled by
 * {@link BrokerManager#nackWithRetry} carries the next attempt and a {@code notBefore} time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobMessage {

    private UUID uploadId;

    @Builder.Default
    private int attempt = 1;

    private Instant notBefore;

    private Instant enqueuedAt;

    public static JobMessage first(UUID uploadId, Instant now) {
        return JobMessage.builder()
                .uploadId(uploadId)
                .enqueuedAt(now)
                .build();
    }

    /**
     * Time left before this message may be processed; zero when it is due.
     */
    public Duration remainingDelay(Clock clock) {
        if (notBefore == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), notBefore);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
