package com.bulk.common.kafka;

/**
 * Centralized Kafka topic names for the bulk upload platform.
 */
public final class KafkaTopics {

    // Upload job queue
    public static final String UPLOAD_JOBS = "bulk-upload.jobs";

    // Dead letter queue
    public static final String DLQ_SUFFIX = ".dlq";
    public static final String UPLOAD_JOBS_DLQ = UPLOAD_JOBS + DLQ_SUFFIX;

    // Record headers
    public static final String HEADER_DLQ_REASON = "x-dlq-reason";

    private KafkaTopics() {
        throw new UnsupportedOperationException("Utility class");
    }
}
