package com.bulk.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single chunk of an upload job.
 * FAILED means an attempt failed and a retry is pending; DEAD_LETTERED is final.
 */
public enum ChunkStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    DEAD_LETTERED;

    public boolean isFinal() {
        return this == COMPLETED || this == DEAD_LETTERED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
