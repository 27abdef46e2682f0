package com.bulk.ingest.pipeline;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;

import org.springframework.dao.DataAccessException;

import com.bulk.common.model.ErrorSeverity;
import com.bulk.ingest.resilience.FailureClassifier;
import com.bulk.ingest.resilience.ResourcePoolManager;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes one chunk: dedup check-and-mark plus sink upsert, committed as a single transaction.
 *
 * <p>A transient failure surfaces as {@link TransientChunkException} for the caller to retry.
 * A fatal failure rolls the chunk back and replays it once row by row under savepoints, so only
 * the offending rows are lost and each one is reported as a fatal row error.
 */
@Slf4j
public class ChunkWriter {

    private final ResourcePoolManager resourcePool;
    private final DeduplicationService deduplication;
    private final InvoiceLineStore sink;
    private final FailureClassifier classifier;

    public ChunkWriter(ResourcePoolManager resourcePool, DeduplicationService deduplication, InvoiceLineStore sink) {
        this.resourcePool = resourcePool;
        this.deduplication = deduplication;
        this.sink = sink;
        this.classifier = resourcePool.getClassifier();
    }

    public ChunkResult write(ChunkWork work) {
        try {
            return resourcePool.withTransaction(connection -> writeBatch(connection, work));
        } catch (RuntimeException e) {
            if (classifier.isTransient(e)) {
                throw new TransientChunkException(work, e);
            }
            log.warn("Chunk {} of upload {} rolled back ({}), replaying rows individually",
                    work.chunkIndex(), work.uploadId(), e.getMessage());
        }

        try {
            return resourcePool.withTransaction(connection -> writeIsolated(connection, work));
        } catch (RuntimeException e) {
            if (classifier.isTransient(e)) {
                throw new TransientChunkException(work, e);
            }
            log.error("Chunk {} of upload {} failed in isolation mode, failing all {} rows",
                    work.chunkIndex(), work.uploadId(), work.size(), e);
            return ChunkResult.allFailed(work, "Chunk write failed: " + e.getMessage(), ErrorSeverity.FATAL);
        }
    }

    private ChunkResult writeBatch(Connection connection, ChunkWork work) throws SQLException {
        List<InvoiceLine> firstSeen = deduplication.checkAndMarkAll(connection, work.lines(), work.uploadId());
        int inserted = sink.upsert(connection, firstSeen, work.uploadId());
        return ChunkResult.builder()
                .inserted(inserted)
                .duplicates(work.size() - firstSeen.size())
                .build();
    }

    private ChunkResult writeIsolated(Connection connection, ChunkWork work) throws SQLException {
        int inserted = 0;
        int duplicates = 0;
        List<RowError> errors = new ArrayList<>();

        for (InvoiceLine line : work.lines()) {
            Savepoint savepoint = connection.setSavepoint();
            try {
                String hash = deduplication.hashOf(line);
                if (deduplication.checkAndMark(connection, hash, work.uploadId())) {
                    sink.upsert(connection, List.of(line), work.uploadId());
                    inserted++;
                } else {
                    duplicates++;
                }
                connection.releaseSavepoint(savepoint);
            } catch (SQLException e) {
                DataAccessException translated = classifier.translate("isolated row write", e);
                if (classifier.isTransient(translated)) {
                    throw e;
                }
                connection.rollback(savepoint);
                log.debug("Row {} of upload {} rejected by the database: {}",
                        line.getRowNumber(), work.uploadId(), e.getMessage());
                errors.add(new RowError(line.getRowNumber(), line.getRawFields(), e.getMessage(),
                        ErrorSeverity.FATAL));
            }
        }
        return ChunkResult.builder()
                .inserted(inserted)
                .duplicates(duplicates)
                .failed(errors.size())
                .errors(errors)
                .build();
    }
}
