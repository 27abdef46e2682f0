package com.bulk.ingest.pipeline;

import java.util.List;
import java.util.UUID;

/**
 * One unit of write work: a contiguous run of accepted rows covering data rows [rowStart, rowEnd).
 */
public record ChunkWork(UUID uploadId, UUID chunkId, int chunkIndex, long rowStart, long rowEnd,
        List<InvoiceLine> lines) {

    public ChunkWork {
        lines = List.copyOf(lines);
    }

    public int size() {
        return lines.size();
    }
}
