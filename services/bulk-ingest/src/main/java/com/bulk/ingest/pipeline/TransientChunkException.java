package com.bulk.ingest.pipeline;

import lombok.Getter;

/**
 * A chunk transaction was rolled back for a reason expected to clear up (connection loss,
 * lock timeout, open circuit). The whole chunk may be retried.
 */
@Getter
public class TransientChunkException extends BulkIngestException {

    private final int chunkIndex;

    public TransientChunkException(ChunkWork work, Throwable cause) {
        super("Chunk " + work.chunkIndex() + " of upload " + work.uploadId() + " failed transiently: "
                + cause.getMessage(), cause);
        this.chunkIndex = work.chunkIndex();
    }
}
