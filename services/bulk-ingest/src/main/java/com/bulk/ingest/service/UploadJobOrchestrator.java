package com.bulk.ingest.service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.springframework.stereotype.Service;

import com.bulk.common.model.ChunkStatus;
import com.bulk.common.model.ErrorSeverity;
import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.config.IngestProperties;
import com.bulk.ingest.model.ProcessingError;
import com.bulk.ingest.model.UploadChunk;
import com.bulk.ingest.model.UploadJob;
import com.bulk.ingest.pipeline.ChunkResult;
import com.bulk.ingest.pipeline.ChunkWork;
import com.bulk.ingest.pipeline.CsvRowParser;
import com.bulk.ingest.pipeline.DeduplicationService;
import com.bulk.ingest.pipeline.InvoiceLine;
import com.bulk.ingest.pipeline.RowCursor;
import com.bulk.ingest.pipeline.RowError;
import com.bulk.ingest.pipeline.RowResult;
import com.bulk.ingest.pipeline.SchemaException;
import com.bulk.ingest.pipeline.SourceReadException;
import com.bulk.ingest.repository.ProcessingErrorRepository;
import com.bulk.ingest.repository.UploadChunkRepository;
import com.bulk.ingest.repository.UploadJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.f4b6a3.uuid.UuidCreator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one upload job from claim to terminal status.
 *
 * Flow:
 * 1. Claim the job (pending, or processing but stale)
 * 2. Stream the staged file through the parser, recording rejected rows
 * 3. Cut accepted rows into chunks and hand them to the shared worker pool
 * 4. Fold chunk outcomes into job counters and the error catalog as they complete
 * 5. Wait for in-flight chunks, decide the final status, clean up the staged file
 *
 * Cancellation is checked before every chunk dispatch, against this instance's reporter and the
 * persisted flag; chunks already handed out finish. Rejected rows are written to the error catalog
 * in batches of at most {@code chunk-size}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadJobOrchestrator {

    private final UploadJobRepository jobRepository;
    private final UploadChunkRepository chunkRepository;
    private final ProcessingErrorRepository errorRepository;
    private final CsvRowParser parser;
    private final DeduplicationService deduplication;
    private final ChunkWorkerPool workerPool;
    private final ChunkProcessor chunkProcessor;
    private final ProgressReporter reporter;
    private final FileStagingService staging;
    private final IngestProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @return the final status, or empty if the job could not be claimed
     */
    public Optional<UploadStatus> run(UUID uploadId) {
        Instant now = clock.instant();
        int claimed = jobRepository.claim(uploadId, now, now.minus(properties.getStaleJobTimeout()),
                UploadStatus.PENDING, UploadStatus.PROCESSING);
        if (claimed == 0) {
            log.info("Upload {} is not claimable (finished, cancelled or owned elsewhere), skipping", uploadId);
            return Optional.empty();
        }
        UploadJob job = jobRepository.findById(uploadId).orElseThrow(() -> new UploadNotFoundException(uploadId));
        log.info("Processing upload {}: file={} declaredRows={}", uploadId, job.getFileName(), job.getDeclaredRowCount());
        reporter.start(job);

        JobRun run = new JobRun(job);
        try {
            readAndDispatch(run);
        } catch (SchemaException | SourceReadException e) {
            log.error("Upload {} failed: {}", uploadId, e.getMessage());
            run.fail(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.fail("Interrupted while dispatching chunks");
        } catch (RuntimeException e) {
            log.error("Upload {} aborted by unexpected error", uploadId, e);
            run.fail("Unexpected error: " + e.getMessage());
        } finally {
            awaitInFlight(run);
            flushErrors(run);
        }

        UploadStatus status = decideStatus(run);
        complete(run, status);
        return Optional.of(status);
    }

    private void readAndDispatch(JobRun run) throws InterruptedException {
        Path path = run.job.getStagedPath() == null ? null : Path.of(run.job.getStagedPath());
        if (path == null || !Files.isReadable(path)) {
            throw new SourceReadException("Staged file not found: " + run.job.getStagedPath(), null);
        }
        int chunkSize = Math.max(1, properties.getChunkSize());

        try (Reader reader = new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8);
                RowCursor cursor = parser.open(reader)) {
            List<InvoiceLine> buffer = new ArrayList<>(chunkSize);
            while (cursor.hasNext()) {
                RowResult row = cursor.next();
                if (!row.isAccepted()) {
                    run.reject(row);
                    continue;
                }
                if (row.hasWarnings()) {
                    run.warn(row);
                }
                InvoiceLine line = row.getLine();
                line.setContentHash(deduplication.contentHash(line));
                buffer.add(line);
                if (buffer.size() >= chunkSize) {
                    if (cancelObserved(run)) {
                        return;
                    }
                    dispatch(run, buffer);
                    buffer = new ArrayList<>(chunkSize);
                }
            }
            if (!buffer.isEmpty() && !cancelObserved(run)) {
                dispatch(run, buffer);
            }
            log.debug("Upload {}: read {} rows into {} chunks", run.uploadId, cursor.getRowNumber(), run.totalChunks);
        } catch (IOException e) {
            throw new SourceReadException("Unable to read staged file " + path + ": " + e.getMessage(), e);
        }
    }

    private boolean cancelObserved(JobRun run) {
        if (!run.cancelled && (reporter.isCancelRequested(run.uploadId) || cancelPersisted(run.uploadId))) {
            log.info("Upload {}: cancel requested, stopping after {} chunks", run.uploadId, run.totalChunks);
            run.cancelled = true;
        }
        return run.cancelled;
    }

    // Picks up cancels recorded by another instance, or before this run registered with the reporter.
    private boolean cancelPersisted(UUID uploadId) {
        try {
            return jobRepository.findCancelRequestedById(uploadId).orElse(false);
        } catch (RuntimeException e) {
            log.warn("Upload {}: could not read cancel flag, continuing: {}", uploadId, e.getMessage());
            return false;
        }
    }

    private void dispatch(JobRun run, List<InvoiceLine> lines) throws InterruptedException {
        flushErrors(run);
        int index = run.totalChunks++;
        Instant now = clock.instant();
        long rowStart = lines.get(0).getRowNumber();
        long rowEnd = lines.get(lines.size() - 1).getRowNumber() + 1;

        UploadChunk chunk = UploadChunk.builder()
                .id(UuidCreator.getTimeOrdered())
                .uploadId(run.uploadId)
                .chunkIndex(index)
                .rowStart(rowStart)
                .rowEnd(rowEnd)
                .rowCount(lines.size())
                .status(ChunkStatus.QUEUED)
                .attemptCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            chunkRepository.save(chunk);
        } catch (RuntimeException e) {
            log.warn("Could not persist chunk {} of upload {}: {}", index, run.uploadId, e.getMessage());
        }

        ChunkWork work = new ChunkWork(run.uploadId, chunk.getId(), index, rowStart, rowEnd, lines);
        run.inFlight.add(workerPool.submit(() -> chunkProcessor.process(work, chunk),
                outcome -> onChunkDone(run, outcome)));
    }

    private void onChunkDone(JobRun run, ChunkOutcome outcome) {
        ChunkResult result = outcome.result();
        synchronized (run) {
            if (!result.getErrors().isEmpty()) {
                errorRepository.saveAll(toEntities(run.uploadId, outcome.work().chunkId(), result.getErrors()));
            }
            if (outcome.isDeadLettered()) {
                run.deadLettered++;
            }
            run.count(result.getInserted(), result.getDuplicates(), result.getFailed());
            reporter.record(run.uploadId, result.getInserted(), result.getDuplicates(), result.getFailed());
            jobRepository.updateProgress(run.uploadId, run.processed, run.duplicates, run.failed,
                    clock.instant(), UploadStatus.PROCESSING);
        }
    }

    private void awaitInFlight(JobRun run) {
        for (CompletableFuture<ChunkOutcome> future : run.inFlight) {
            try {
                future.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Upload {}: chunk result could not be recorded", run.uploadId, cause);
                run.fail("Chunk result could not be recorded: " + cause.getMessage());
            }
        }
    }

    private void flushErrors(JobRun run) {
        List<ProcessingError> pending;
        synchronized (run) {
            if (run.pendingErrors.isEmpty()) {
                return;
            }
            pending = new ArrayList<>(run.pendingErrors);
            run.pendingErrors.clear();
        }
        errorRepository.saveAll(pending);
    }

    private void flushErrorsIfFull(JobRun run) {
        boolean full;
        synchronized (run) {
            full = run.pendingErrors.size() >= run.errorBatchSize;
        }
        if (full) {
            flushErrors(run);
        }
    }

    private UploadStatus decideStatus(JobRun run) {
        if (run.cancelled) {
            return UploadStatus.CANCELLED;
        }
        if (run.failureReason != null) {
            return UploadStatus.FAILED;
        }
        if (run.totalChunks > 0
                && (double) run.deadLettered / run.totalChunks >= properties.getDeadLetterFailureRatio()) {
            run.fail(run.deadLettered + " of " + run.totalChunks + " chunks dead-lettered");
            return UploadStatus.FAILED;
        }
        return run.failed == 0 ? UploadStatus.COMPLETED : UploadStatus.PARTIALLY_COMPLETED;
    }

    private void complete(JobRun run, UploadStatus status) {
        UploadJob job = jobRepository.findById(run.uploadId).orElse(run.job);
        job.setProcessedRows(run.processed);
        job.setDuplicateRows(run.duplicates);
        job.setFailedRows(run.failed);
        job.setFailureReason(run.failureReason);
        job.transitionTo(status, clock.instant());
        jobRepository.save(job);

        reporter.finish(run.uploadId, status);
        staging.delete(job.getStagedPath());

        Counter.builder("bulk.ingest.jobs.finished")
                .tag("status", status.value())
                .register(meterRegistry)
                .increment();
        log.info("Upload {} {}: processed={} duplicates={} failed={} chunks={} deadLettered={}",
                run.uploadId, status.value(), run.processed, run.duplicates, run.failed,
                run.totalChunks, run.deadLettered);
    }

    private List<ProcessingError> toEntities(UUID uploadId, UUID chunkId, List<RowError> errors) {
        Instant now = clock.instant();
        return errors.stream()
                .map(error -> ProcessingError.builder()
                        .uploadId(uploadId)
                        .chunkId(chunkId)
                        .rowNumber(error.rowNumber())
                        .rawRow(UploadJobMapper.rawRowJson(objectMapper, error.rawFields()))
                        .errorMessage(error.message())
                        .severity(error.severity())
                        .createdAt(now)
                        .build())
                .toList();
    }

    /**
     * Mutable state of one run. Counters are touched by the reader thread and by worker
     * threads completing chunks, always under the instance lock.
     */
    private class JobRun {

        private final UploadJob job;
        private final UUID uploadId;
        private final List<CompletableFuture<ChunkOutcome>> inFlight = new ArrayList<>();
        private final List<ProcessingError> pendingErrors = new ArrayList<>();
        private final int errorBatchSize = Math.max(1, properties.getChunkSize());

        private long processed;
        private long duplicates;
        private long failed;
        private int totalChunks;
        private int deadLettered;
        private volatile boolean cancelled;
        private volatile String failureReason;

        JobRun(UploadJob job) {
            this.job = job;
            this.uploadId = job.getId();
        }

        synchronized void count(long inserted, long duplicateRows, long failedRows) {
            processed += inserted;
            duplicates += duplicateRows;
            failed += failedRows;
        }

        void reject(RowResult row) {
            synchronized (this) {
                pendingErrors.add(rowError(row, row.rejectionMessage()));
                failed++;
            }
            reporter.record(uploadId, 0, 0, 1);
            flushErrorsIfFull(this);
        }

        void warn(RowResult row) {
            synchronized (this) {
                for (String warning : row.getWarnings()) {
                    pendingErrors.add(rowError(row, "Warning: " + warning));
                }
            }
            flushErrorsIfFull(this);
        }

        void fail(String reason) {
            if (failureReason == null) {
                failureReason = reason;
            }
        }

        private ProcessingError rowError(RowResult row, String message) {
            return ProcessingError.builder()
                    .uploadId(uploadId)
                    .rowNumber(row.getRowNumber())
                    .rawRow(UploadJobMapper.rawRowJson(objectMapper, row.getRawFields()))
                    .errorMessage(message)
                    .severity(ErrorSeverity.VALIDATION)
                    .createdAt(clock.instant())
                    .build();
        }
    }
}
