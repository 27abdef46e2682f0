package com.bulk.ingest.service;

import com.bulk.common.model.ChunkStatus;
import com.bulk.ingest.pipeline.ChunkResult;
import com.bulk.ingest.pipeline.ChunkWork;

/**
 * Final result of a chunk after all retries: either completed or dead-lettered.
 */
public record ChunkOutcome(ChunkWork work, ChunkResult result, ChunkStatus status, int attempts) {

    public boolean isDeadLettered() {
        return status == ChunkStatus.DEAD_LETTERED;
    }
}
