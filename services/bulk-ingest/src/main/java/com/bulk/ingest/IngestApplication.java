package com.bulk.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bulk Ingest Service - Large invoice-line file ingestion.
 *
 * Responsibilities:
 * - Accept CSV uploads via REST, stage them and queue a job on Kafka
 * - Stream, validate and deduplicate rows
 * - Write chunks in parallel through a circuit-breaker-guarded connection pool
 * - Track job, chunk and row-error state in PostgreSQL
 * - Report progress by polling and Server-Sent Events
 */
@SpringBootApplication
@EnableScheduling
@EnableKafka
@ConfigurationPropertiesScan
public class IngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }
}
