package com.bulk.ingest.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.bulk.common.model.UploadJobDTO;
import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.broker.BrokerManager;
import com.bulk.ingest.broker.JobMessage;
import com.bulk.ingest.model.UploadJob;
import com.bulk.ingest.pipeline.CsvRowParser;
import com.bulk.ingest.pipeline.SourceReadException;
import com.bulk.ingest.repository.UploadJobRepository;
import com.github.f4b6a3.uuid.UuidCreator;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts an uploaded file: stage it, count its rows, record a pending job and queue it.
 * A job is only reported as accepted once its queue message is durably published.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadSubmissionService {

    private final UploadJobRepository jobRepository;
    private final BrokerManager brokerManager;
    private final FileStagingService staging;
    private final CsvRowParser parser;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException if the file holds no data rows
     * @throws com.bulk.ingest.resilience.CircuitOpenException if the broker circuit is open
     * @throws com.bulk.ingest.broker.BrokerUnavailableException if the job could not be queued
     */
    public UploadJobDTO submit(String fileName, long fileSize, String ownerId, InputStream content) {
        brokerManager.ensureAvailable();

        UUID uploadId = UuidCreator.getTimeOrdered();
        Path staged = staging.stage(uploadId, content);
        long rows;
        try {
            rows = countRows(staged);
        } catch (RuntimeException e) {
            staging.delete(staged.toString());
            throw e;
        }
        if (rows == 0) {
            staging.delete(staged.toString());
            throw new IllegalArgumentException("File contains no data rows");
        }

        Instant now = clock.instant();
        UploadJob job = jobRepository.save(UploadJob.builder()
                .id(uploadId)
                .fileName(fileName == null || fileName.isBlank() ? "upload.csv" : fileName)
                .fileSize(fileSize)
                .declaredRowCount(rows)
                .stagedPath(staged.toString())
                .status(UploadStatus.PENDING)
                .processedRows(0L)
                .duplicateRows(0L)
                .failedRows(0L)
                .cancelRequested(false)
                .ownerId(ownerId)
                .createdAt(now)
                .updatedAt(now)
                .build());

        try {
            brokerManager.enqueue(JobMessage.first(uploadId, now));
        } catch (RuntimeException e) {
            log.error("Upload {} could not be queued, marking failed: {}", uploadId, e.getMessage());
            job.setFailureReason("Could not enqueue job: " + e.getMessage());
            job.transitionTo(UploadStatus.FAILED, clock.instant());
            jobRepository.save(job);
            staging.delete(staged.toString());
            incrementCounter("uploads.rejected");
            throw e;
        }

        incrementCounter("uploads.accepted");
        log.info("Accepted upload {}: file={} rows={} owner={}", uploadId, job.getFileName(), rows, ownerId);
        return UploadJobMapper.toDto(job);
    }

    private long countRows(Path staged) {
        try (Reader reader = new InputStreamReader(Files.newInputStream(staged), StandardCharsets.UTF_8)) {
            return parser.countRows(reader);
        } catch (IOException e) {
            throw new SourceReadException("Unable to read staged file " + staged + ": " + e.getMessage(), e);
        }
    }

    private void incrementCounter(String name) {
        Counter.builder("bulk.ingest." + name)
                .tag("service", "bulk-ingest")
                .register(meterRegistry)
                .increment();
    }
}
