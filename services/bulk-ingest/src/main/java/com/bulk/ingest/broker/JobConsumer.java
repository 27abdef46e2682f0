package com.bulk.ingest.broker;

import java.time.Clock;
import java.time.Duration;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import com.bulk.ingest.resilience.CircuitOpenException;
import com.bulk.ingest.service.UploadJobOrchestrator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka consumer for the upload job topic.
 *
 * Flow:
 * 1. Claim the message (decode, guarded by the broker breaker)
 * 2. If it is scheduled for later, put it back and pause the partition until due
 * 3. Run the job to completion on this listener thread
 * 4. Acknowledge; on failure schedule a retry (or dead-letter) first
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobConsumer {

    private static final Duration REDELIVERY_PAUSE = Duration.ofSeconds(5);

    private final BrokerManager brokerManager;
    private final UploadJobOrchestrator orchestrator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @KafkaListener(
        topics = "${bulk.ingest.topics.jobs:bulk-upload.jobs}",
        groupId = "${spring.kafka.consumer.group-id:bulk-ingest}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(
            @Payload String payload,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Consuming job message from partition {} offset {}: key={}", partition, offset, key);

        JobMessage message;
        try {
            message = brokerManager.claim(payload);
        } catch (CircuitOpenException e) {
            log.warn("Broker circuit open, redelivering offset {} in {}ms", offset, e.getRetryAfter().toMillis());
            acknowledgment.nack(atLeast(e.getRetryAfter()));
            return;
        } catch (IllegalArgumentException e) {
            log.error("Discarding malformed job message at partition {} offset {}: {}", partition, offset, e.getMessage());
            incrementCounter("jobs.malformed");
            deadLetterOrRedeliver(key, payload, e.getMessage(), acknowledgment);
            return;
        }

        Duration wait = message.remainingDelay(clock);
        if (!wait.isZero()) {
            log.debug("Upload {} attempt {} not due for {}ms", message.getUploadId(), message.getAttempt(), wait.toMillis());
            acknowledgment.nack(wait);
            return;
        }

        try {
            orchestrator.run(message.getUploadId())
                    .ifPresent(status -> incrementCounter("jobs." + status.value()));
            brokerManager.ack(acknowledgment);
        } catch (RuntimeException e) {
            log.error("Upload {} attempt {} failed: {}", message.getUploadId(), message.getAttempt(), e.getMessage(), e);
            incrementCounter("jobs.errors");
            try {
                brokerManager.nackWithRetry(message, e);
                brokerManager.ack(acknowledgment);
            } catch (RuntimeException publishFailure) {
                log.warn("Could not schedule retry for upload {}, redelivering: {}",
                        message.getUploadId(), publishFailure.getMessage());
                acknowledgment.nack(REDELIVERY_PAUSE);
            }
        }
    }

    private void deadLetterOrRedeliver(String key, String payload, String reason, Acknowledgment acknowledgment) {
        try {
            brokerManager.deadLetterPayload(key, payload, reason);
            brokerManager.ack(acknowledgment);
        } catch (RuntimeException e) {
            log.warn("Could not dead-letter malformed message, redelivering: {}", e.getMessage());
            acknowledgment.nack(REDELIVERY_PAUSE);
        }
    }

    private static Duration atLeast(Duration retryAfter) {
        return retryAfter.compareTo(Duration.ofMillis(100)) < 0 ? Duration.ofMillis(100) : retryAfter;
    }

    private void incrementCounter(String name) {
        Counter.builder("bulk.ingest.consumer." + name)
                .tag("service", "bulk-ingest")
                .register(meterRegistry)
                .increment();
    }
}
