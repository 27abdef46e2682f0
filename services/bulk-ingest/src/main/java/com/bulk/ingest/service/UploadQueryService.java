package com.bulk.ingest.service;

import java.time.Clock;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import com.bulk.common.model.ProcessingErrorDTO;
import com.bulk.common.model.UploadJobDTO;
import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.model.UploadJob;
import com.bulk.ingest.repository.ProcessingErrorRepository;
import com.bulk.ingest.repository.UploadJobRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read side of the front door plus cancellation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadQueryService {

    private static final int MAX_PAGE_SIZE = 500;

    private final UploadJobRepository jobRepository;
    private final ProcessingErrorRepository errorRepository;
    private final ProgressReporter reporter;
    private final FileStagingService staging;
    private final Clock clock;

    public UploadJobDTO getStatus(UUID uploadId) {
        return reporter.snapshot(uploadId).orElseThrow(() -> new UploadNotFoundException(uploadId));
    }

    /**
     * Error catalog page, ordered by row number.
     */
    public Page<ProcessingErrorDTO> getErrors(UUID uploadId, int page, int size) {
        if (!jobRepository.existsById(uploadId)) {
            throw new UploadNotFoundException(uploadId);
        }
        PageRequest request = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        return errorRepository.findByUploadIdOrderByRowNumberAscIdAsc(uploadId, request)
                .map(UploadJobMapper::toDto);
    }

    /**
     * Cancels a pending job outright, or asks a running job to stop before its next chunk.
     *
     * @throws IllegalStateException if the job already reached a terminal status
     */
    public UploadJobDTO cancel(UUID uploadId) {
        UploadJob job = jobRepository.findById(uploadId).orElseThrow(() -> new UploadNotFoundException(uploadId));
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Upload " + uploadId + " is already " + job.getStatus().value());
        }

        if (job.getStatus() == UploadStatus.PENDING
                && jobRepository.cancelPending(uploadId, clock.instant(), UploadStatus.PENDING,
                        UploadStatus.CANCELLED) == 1) {
            log.info("Cancelled pending upload {}", uploadId);
            staging.delete(job.getStagedPath());
            reporter.finish(uploadId, UploadStatus.CANCELLED);
            return getStatus(uploadId);
        }

        jobRepository.markCancelRequested(uploadId, clock.instant());
        reporter.requestCancel(uploadId);
        log.info("Cancel requested for running upload {}", uploadId);
        return getStatus(uploadId);
    }
}
