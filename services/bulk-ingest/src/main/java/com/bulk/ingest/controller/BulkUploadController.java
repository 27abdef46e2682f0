package com.bulk.ingest.controller;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.bulk.common.model.ProcessingErrorDTO;
import com.bulk.common.model.ProgressEvent;
import com.bulk.common.model.UploadJobDTO;
import com.bulk.ingest.broker.BrokerUnavailableException;
import com.bulk.ingest.resilience.CircuitOpenException;
import com.bulk.ingest.service.ProgressListener;
import com.bulk.ingest.service.ProgressReporter;
import com.bulk.ingest.service.Subscription;
import com.bulk.ingest.service.UploadNotFoundException;
import com.bulk.ingest.service.UploadQueryService;
import com.bulk.ingest.service.UploadSubmissionService;

import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for bulk invoice uploads.
 * Submission answers as soon as the job is queued; processing happens in the background.
 */
@RestController
@RequestMapping("/bulk-upload")
@RequiredArgsConstructor
@Slf4j
public class BulkUploadController {

    private static final long BROKER_RETRY_AFTER_SECONDS = 30;
    private static final long SSE_TIMEOUT_MS = Duration.ofHours(1).toMillis();

    private final UploadSubmissionService submissionService;
    private final UploadQueryService queryService;
    private final ProgressReporter progressReporter;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "ownerId", required = false, defaultValue = "anonymous") String ownerId)
            throws IOException {
        log.info("Received upload: file={}, size={}, owner={}", file.getOriginalFilename(), file.getSize(), ownerId);
        if (file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }

        UploadJobDTO job;
        try (InputStream content = file.getInputStream()) {
            job = submissionService.submit(file.getOriginalFilename(), file.getSize(), ownerId, content);
        }

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(UploadResponse.builder()
                .uploadId(job.getUploadId())
                .status(job.getStatus().value())
                .declaredRowCount(job.getTotalRows())
                .message("Upload accepted for processing")
                .timestamp(System.currentTimeMillis())
                .build());
    }

    @GetMapping("/{uploadId}/status")
    public ResponseEntity<UploadJobDTO> getStatus(@PathVariable UUID uploadId) {
        return ResponseEntity.ok(queryService.getStatus(uploadId));
    }

    @GetMapping(path = "/{uploadId}/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamProgress(@PathVariable UUID uploadId) {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        Subscription subscription = progressReporter.subscribe(uploadId, new ProgressListener() {
            @Override
            public void onEvent(ProgressEvent event) {
                try {
                    emitter.send(SseEmitter.event().name("progress").data(event, MediaType.APPLICATION_JSON));
                } catch (IOException e) {
                    throw new IllegalStateException("Progress client disconnected", e);
                }
            }

            @Override
            public void onComplete() {
                emitter.complete();
            }
        });
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(failure -> subscription.close());
        return emitter;
    }

    @GetMapping("/{uploadId}/errors")
    public ResponseEntity<ErrorPage> getErrors(
            @PathVariable UUID uploadId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        Page<ProcessingErrorDTO> errors = queryService.getErrors(uploadId, page, size);
        return ResponseEntity.ok(ErrorPage.builder()
                .uploadId(uploadId)
                .page(errors.getNumber())
                .size(errors.getSize())
                .totalElements(errors.getTotalElements())
                .totalPages(errors.getTotalPages())
                .errors(errors.getContent())
                .build());
    }

    @PostMapping("/{uploadId}/cancel")
    public ResponseEntity<UploadJobDTO> cancel(@PathVariable UUID uploadId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queryService.cancel(uploadId));
    }

    @ExceptionHandler({ IllegalArgumentException.class, MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class })
    public ResponseEntity<UploadResponse> handleBadRequest(Exception ex) {
        log.warn("Invalid upload request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(message(ex.getMessage()));
    }

    @ExceptionHandler(UploadNotFoundException.class)
    public ResponseEntity<UploadResponse> handleNotFound(UploadNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(message(ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<UploadResponse> handleConflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(message(ex.getMessage()));
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<UploadResponse> handleCircuitOpen(CircuitOpenException ex) {
        long retryAfter = Math.max(1, (ex.getRetryAfter().toMillis() + 999) / 1000);
        log.warn("Rejecting request, {} circuit open for {}s", ex.getResource(), retryAfter);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                .body(message("Service temporarily unavailable: " + ex.getResource() + " circuit is open"));
    }

    @ExceptionHandler(BrokerUnavailableException.class)
    public ResponseEntity<UploadResponse> handleBrokerUnavailable(BrokerUnavailableException ex) {
        log.warn("Rejecting upload, job queue unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(BROKER_RETRY_AFTER_SECONDS))
                .body(message("Job queue unavailable, retry later"));
    }

    private static UploadResponse message(String message) {
        return UploadResponse.builder()
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    @Data
    @Builder
    public static class UploadResponse {
        private UUID uploadId;
        private String status;
        private Long declaredRowCount;
        private String message;
        private Long timestamp;
    }

    @Data
    @Builder
    public static class ErrorPage {
        private UUID uploadId;
        private int page;
        private int size;
        private long totalElements;
        private int totalPages;
        private List<ProcessingErrorDTO> errors;
    }
}
