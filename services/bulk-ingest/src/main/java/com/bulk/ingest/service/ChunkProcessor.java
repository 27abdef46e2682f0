package com.bulk.ingest.service;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.bulk.common.model.ChunkStatus;
import com.bulk.common.model.ErrorSeverity;
import com.bulk.ingest.config.IngestProperties;
import com.bulk.ingest.model.UploadChunk;
import com.bulk.ingest.pipeline.ChunkResult;
import com.bulk.ingest.pipeline.ChunkWork;
import com.bulk.ingest.pipeline.ChunkWriter;
import com.bulk.ingest.pipeline.TransientChunkException;
import com.bulk.ingest.repository.UploadChunkRepository;
import com.bulk.ingest.resilience.RetryBackoff;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one chunk on a worker thread: write, retry transient failures with backoff,
 * dead-letter once attempts are exhausted. Chunk bookkeeping rows are kept current
 * along the way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkProcessor {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final ChunkWriter chunkWriter;
    private final UploadChunkRepository chunkRepository;
    private final RetryBackoff retryBackoff;
    private final IngestProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ChunkOutcome process(ChunkWork work, UploadChunk chunk) {
        int maxAttempts = Math.max(1, properties.getMaxRetryAttempts());
        int attempt = 0;
        while (true) {
            attempt++;
            chunk.setStatus(ChunkStatus.PROCESSING);
            chunk.setAttemptCount(attempt);
            saveChunk(chunk);
            try {
                ChunkResult result = chunkWriter.write(work);
                chunk.setStatus(ChunkStatus.COMPLETED);
                chunk.setInsertedRows(result.getInserted());
                chunk.setDuplicateRows(result.getDuplicates());
                chunk.setFailedRows(result.getFailed());
                saveChunk(chunk);
                incrementCounter("chunks.completed");
                log.debug("Chunk {} of upload {} done on attempt {}: inserted={} duplicates={} failed={}",
                        work.chunkIndex(), work.uploadId(), attempt,
                        result.getInserted(), result.getDuplicates(), result.getFailed());
                return new ChunkOutcome(work, result, ChunkStatus.COMPLETED, attempt);
            } catch (TransientChunkException e) {
                chunk.setLastError(truncate(e.getMessage()));
                if (attempt >= maxAttempts) {
                    return deadLetter(work, chunk, attempt, "Dead-lettered after " + attempt
                            + " attempts: " + e.getMessage(), ErrorSeverity.TRANSIENT);
                }
                chunk.setStatus(ChunkStatus.FAILED);
                saveChunk(chunk);
                incrementCounter("chunks.retried");
                log.warn("Chunk {} of upload {} attempt {}/{} failed transiently, backing off {}ms: {}",
                        work.chunkIndex(), work.uploadId(), attempt, maxAttempts,
                        retryBackoff.delayAfter(attempt).toMillis(), e.getMessage());
                try {
                    retryBackoff.sleepAfter(attempt);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return deadLetter(work, chunk, attempt, "Interrupted while waiting to retry: "
                            + e.getMessage(), ErrorSeverity.TRANSIENT);
                }
            } catch (RuntimeException e) {
                chunk.setLastError(truncate(e.getMessage()));
                log.error("Chunk {} of upload {} failed unexpectedly", work.chunkIndex(), work.uploadId(), e);
                return deadLetter(work, chunk, attempt, "Unexpected failure: " + e.getMessage(),
                        ErrorSeverity.FATAL);
            }
        }
    }

    private ChunkOutcome deadLetter(ChunkWork work, UploadChunk chunk, int attempt, String reason,
            ErrorSeverity severity) {
        ChunkResult result = ChunkResult.allFailed(work, reason, severity);
        chunk.setStatus(ChunkStatus.DEAD_LETTERED);
        chunk.setInsertedRows(0);
        chunk.setDuplicateRows(0);
        chunk.setFailedRows(result.getFailed());
        saveChunk(chunk);
        incrementCounter("chunks.dead_lettered");
        log.error("Chunk {} of upload {} (rows {}-{}) dead-lettered: {}",
                work.chunkIndex(), work.uploadId(), work.rowStart(), work.rowEnd() - 1, reason);
        return new ChunkOutcome(work, result, ChunkStatus.DEAD_LETTERED, attempt);
    }

    // Chunk rows are bookkeeping only; losing one update must not fail the write itself.
    private void saveChunk(UploadChunk chunk) {
        chunk.setUpdatedAt(clock.instant());
        try {
            chunkRepository.save(chunk);
        } catch (RuntimeException e) {
            log.warn("Could not persist state {} of chunk {}: {}", chunk.getStatus(), chunk.getId(), e.getMessage());
        }
    }

    private void incrementCounter(String name) {
        Counter.builder("bulk.ingest." + name)
                .tag("service", "bulk-ingest")
                .register(meterRegistry)
                .increment();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
