package com.bulk.ingest.broker;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import com.bulk.common.kafka.KafkaTopics;
import com.bulk.ingest.config.IngestProperties;
import com.bulk.ingest.resilience.CircuitBreaker;
import com.bulk.ingest.resilience.CircuitOpenException;
import com.bulk.ingest.resilience.RetryBackoff;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Durable job queue on Kafka, guarded by the broker circuit breaker.
 *
 * <p>Publishes are synchronous with a timeout so the caller knows the job is durably queued
 * before answering the client. Consecutive publish failures open the circuit; while it is open
 * every call fails fast with {@link CircuitOpenException} and Kafka is not touched.
 */
@Slf4j
public class BrokerManager {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final IngestProperties.Broker properties;
    private final IngestProperties.Topics topics;
    private final RetryBackoff retryBackoff;
    private final Clock clock;

    public BrokerManager(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
            CircuitBreaker circuitBreaker, IngestProperties ingestProperties, Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.properties = ingestProperties.getBroker();
        this.topics = ingestProperties.getTopics();
        this.retryBackoff = new RetryBackoff(properties.getRetryInitialBackoff(), properties.getRetryMaxBackoff());
        this.clock = clock;
    }

    public void enqueue(JobMessage message) {
        publish(topics.getJobs(), message.getUploadId().toString(), serialize(message), null);
        log.info("Enqueued upload {} (attempt {})", message.getUploadId(), message.getAttempt());
    }

    /**
     * Decodes a delivered payload. Rejected while the broker circuit is open so a consumer
     * backs off together with the producers.
     *
     * @throws IllegalArgumentException if the payload is not a job message
     */
    public JobMessage claim(String payload) {
        circuitBreaker.acquirePermission();
        try {
            JobMessage message = objectMapper.readValue(payload, JobMessage.class);
            if (message.getUploadId() == null) {
                throw new IllegalArgumentException("Job message without uploadId");
            }
            circuitBreaker.onSuccess();
            return message;
        } catch (JsonProcessingException e) {
            circuitBreaker.onIgnored();
            throw new IllegalArgumentException("Malformed job message: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            circuitBreaker.onIgnored();
            throw e;
        }
    }

    public void ack(Acknowledgment acknowledgment) {
        acknowledgment.acknowledge();
    }

    /**
     * Schedules another attempt with exponential backoff, or dead-letters the message once
     * {@code maxClaimAttempts} is used up.
     */
    public void nackWithRetry(JobMessage message, Throwable cause) {
        if (message.getAttempt() >= properties.getMaxClaimAttempts()) {
            deadLetter(message, "Gave up after " + message.getAttempt() + " attempts: " + cause.getMessage());
            return;
        }
        Duration delay = retryBackoff.delayAfter(message.getAttempt());
        JobMessage retry = message.toBuilder()
                .attempt(message.getAttempt() + 1)
                .notBefore(clock.instant().plus(delay))
                .build();
        publish(topics.getJobs(), message.getUploadId().toString(), serialize(retry), null);
        log.warn("Upload {} attempt {} failed ({}), retrying in {}ms",
                message.getUploadId(), message.getAttempt(), cause.getMessage(), delay.toMillis());
    }

    public void deadLetter(JobMessage message, String reason) {
        deadLetterPayload(message.getUploadId().toString(), serialize(message), reason);
    }

    /**
     * Dead-letters a payload that could not be decoded into a {@link JobMessage}.
     */
    public void deadLetterPayload(String key, String payload, String reason) {
        publish(topics.getJobsDeadLetter(), key, payload, reason);
        log.error("Dead-lettered job message {} to {}: {}", key, topics.getJobsDeadLetter(), reason);
    }

    public boolean isAvailable() {
        return circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    /**
     * @throws CircuitOpenException while the broker circuit is open
     */
    public void ensureAvailable() {
        if (!isAvailable()) {
            throw new CircuitOpenException(circuitBreaker.getName(), circuitBreaker.getRetryAfter());
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private void publish(String topic, String key, String payload, String dlqReason) {
        circuitBreaker.acquirePermission();
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        if (dlqReason != null) {
            record.headers().add(KafkaTopics.HEADER_DLQ_REASON, dlqReason.getBytes(StandardCharsets.UTF_8));
        }
        try {
            kafkaTemplate.send(record).get(properties.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            circuitBreaker.onSuccess();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.onIgnored();
            throw new BrokerUnavailableException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            circuitBreaker.onFailure();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new BrokerUnavailableException("Publish to " + topic + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            circuitBreaker.onFailure();
            throw new BrokerUnavailableException("Publish to " + topic + " timed out after "
                    + properties.getSendTimeout().toMillis() + "ms", e);
        } catch (RuntimeException e) {
            circuitBreaker.onFailure();
            throw new BrokerUnavailableException("Publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    private String serialize(JobMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job message for " + message.getUploadId(), e);
        }
    }
}
