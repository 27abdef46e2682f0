package com.bulk.ingest.config;

import java.time.Clock;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.bulk.ingest.broker.BrokerManager;
import com.bulk.ingest.pipeline.ChunkWriter;
import com.bulk.ingest.pipeline.ContentHasher;
import com.bulk.ingest.pipeline.CsvRowParser;
import com.bulk.ingest.pipeline.DateNormalizer;
import com.bulk.ingest.pipeline.DeduplicationService;
import com.bulk.ingest.pipeline.JdbcDedupStore;
import com.bulk.ingest.pipeline.JdbcInvoiceLineStore;
import com.bulk.ingest.pipeline.RowValidator;
import com.bulk.ingest.resilience.CircuitBreaker;
import com.bulk.ingest.resilience.FailureClassifier;
import com.bulk.ingest.resilience.ResourcePoolManager;
import com.bulk.ingest.resilience.RetryBackoff;
import com.bulk.ingest.service.ChunkWorkerPool;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the pipeline components, which are plain classes so tests can build them directly.
 */
@Configuration
@Slf4j
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FailureClassifier failureClassifier() {
        return new FailureClassifier();
    }

    @Bean
    public ResourcePoolManager resourcePoolManager(DataSource dataSource, FailureClassifier failureClassifier,
            IngestProperties properties, Clock clock) {
        CircuitBreaker breaker = new CircuitBreaker("database", properties.getDatabase().getFailureThreshold(),
                properties.getDatabase().getCoolDown(), clock);
        return new ResourcePoolManager(dataSource, breaker, failureClassifier);
    }

    @Bean
    public BrokerManager brokerManager(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
            IngestProperties properties, Clock clock) {
        CircuitBreaker breaker = new CircuitBreaker("broker", properties.getBroker().getFailureThreshold(),
                properties.getBroker().getCoolDown(), clock);
        return new BrokerManager(kafkaTemplate, objectMapper, breaker, properties, clock);
    }

    @Bean
    public ThreadPoolTaskExecutor chunkTaskExecutor(IngestProperties properties) {
        int poolSize = properties.resolvedWorkerPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        // ChunkWorkerPool bounds admission; the queue only has to absorb every admitted chunk.
        executor.setQueueCapacity(chunkSlots(properties));
        executor.setThreadNamePrefix("chunk-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        log.info("Chunk worker pool: {} threads, {} queued chunks", poolSize, properties.getChunkQueueCapacity());
        return executor;
    }

    /**
     * One thread with an unbounded FIFO queue: progress listeners must see events in order.
     */
    @Bean
    public ThreadPoolTaskExecutor progressDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("progress-dispatcher-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    @Bean
    public ChunkWorkerPool chunkWorkerPool(@Qualifier("chunkTaskExecutor") ThreadPoolTaskExecutor chunkTaskExecutor,
            IngestProperties properties) {
        return new ChunkWorkerPool(chunkTaskExecutor, chunkSlots(properties));
    }

    private static int chunkSlots(IngestProperties properties) {
        return properties.resolvedWorkerPoolSize() + Math.max(0, properties.getChunkQueueCapacity());
    }

    @Bean
    public RetryBackoff chunkRetryBackoff(IngestProperties properties) {
        return new RetryBackoff(properties.getRetryInitialBackoff(), properties.getRetryMaxBackoff());
    }

    @Bean
    public DateNormalizer dateNormalizer(IngestProperties properties) {
        return new DateNormalizer(properties.getValidation().getTwoDigitYearPivot());
    }

    @Bean
    public RowValidator rowValidator(DateNormalizer dateNormalizer, IngestProperties properties) {
        return new RowValidator(dateNormalizer, properties.getValidation());
    }

    @Bean
    public CsvRowParser csvRowParser(RowValidator rowValidator) {
        return new CsvRowParser(rowValidator);
    }

    @Bean
    public DeduplicationService deduplicationService() {
        return new DeduplicationService(new ContentHasher(), new JdbcDedupStore());
    }

    @Bean
    public ChunkWriter chunkWriter(ResourcePoolManager resourcePoolManager, DeduplicationService deduplicationService) {
        return new ChunkWriter(resourcePoolManager, deduplicationService, new JdbcInvoiceLineStore());
    }
}
