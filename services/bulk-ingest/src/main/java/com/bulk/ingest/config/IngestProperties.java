package com.bulk.ingest.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.bulk.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the bulk ingest service
 */
@Data
@ConfigurationProperties(prefix = "bulk.ingest")
public class IngestProperties {

    /** Accepted rows per chunk; one chunk is one database transaction. */
    private int chunkSize = 250;

    /** Chunk worker threads. Zero or less means twice the available processors. */
    private int workerPoolSize = 0;

    /** Chunks allowed to wait for a worker before the file reader is paused. */
    private int chunkQueueCapacity = 16;

    private int maxRetryAttempts = 3;

    private Duration retryInitialBackoff = Duration.ofMillis(200);

    private Duration retryMaxBackoff = Duration.ofSeconds(5);

    /** Fraction of dead-lettered chunks at which the whole job is failed. */
    private double deadLetterFailureRatio = 0.5;

    /** Jobs orchestrated at the same time (Kafka listener concurrency). */
    private int maxConcurrentJobs = 2;

    private String stagingDir = System.getProperty("java.io.tmpdir") + "/bulk-ingest";

    /** A processing job without updates for this long may be claimed again. */
    private Duration staleJobTimeout = Duration.ofMinutes(10);

    private Validation validation = new Validation();
    private Breaker database = new Breaker();
    private Broker broker = new Broker();
    private Topics topics = new Topics();
    private Sweeper sweeper = new Sweeper();

    public int resolvedWorkerPoolSize() {
        return workerPoolSize > 0 ? workerPoolSize : Runtime.getRuntime().availableProcessors() * 2;
    }

    public enum AmountMismatchPolicy {
        WARN, REJECT
    }

    @Data
    public static class Validation {
        private AmountMismatchPolicy amountMismatchPolicy = AmountMismatchPolicy.WARN;
        private double amountTolerance = 0.01;
        private int twoDigitYearPivot = 50;
    }

    @Data
    public static class Breaker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
    }

    @Data
    public static class Broker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
        private Duration sendTimeout = Duration.ofSeconds(10);
        private int maxClaimAttempts = 5;
        private Duration retryInitialBackoff = Duration.ofSeconds(1);
        private Duration retryMaxBackoff = Duration.ofMinutes(1);
    }

    @Data
    public static class Topics {
        private String jobs = KafkaTopics.UPLOAD_JOBS;
        private String jobsDeadLetter = KafkaTopics.UPLOAD_JOBS_DLQ;
    }

    @Data
    public static class Sweeper {
        private boolean enabled = true;
        private Duration requeueAfter = Duration.ofMinutes(5);
        private Duration interval = Duration.ofMinutes(1);
    }
}
