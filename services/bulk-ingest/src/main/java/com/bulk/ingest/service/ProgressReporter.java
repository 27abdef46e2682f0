package com.bulk.ingest.service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import com.bulk.common.model.ProgressEvent;
import com.bulk.common.model.UploadJobDTO;
import com.bulk.common.model.UploadStatus;
import com.bulk.ingest.model.UploadJob;
import com.bulk.ingest.repository.UploadJobRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-job progress counters with a pull surface ({@link #snapshot}) and a push surface
 * ({@link #subscribe}).
 *
 * <p>Events are handed to listeners on a single dispatcher thread ({@code progressDispatchExecutor},
 * one thread, FIFO queue), so every listener sees them in the order the counters changed. A job is live from {@link #start} until
 * {@link #finish}; outside that window snapshots come from the database.
 */
@Service
@Slf4j
public class ProgressReporter {

    private final UploadJobRepository repository;
    private final Clock clock;
    private final Map<UUID, JobProgress> live = new ConcurrentHashMap<>();
    private final TaskExecutor dispatcher;

    public ProgressReporter(UploadJobRepository repository, Clock clock,
            @Qualifier("progressDispatchExecutor") TaskExecutor dispatcher) {
        this.repository = repository;
        this.clock = clock;
        this.dispatcher = dispatcher;
    }

    /**
     * Makes a freshly claimed job live with zeroed counters. Subscribers that attached while
     * the job was still pending keep their subscription.
     */
    public void start(UploadJob job) {
        UploadJobDTO dto = UploadJobMapper.toDto(job);
        JobProgress progress = live.computeIfAbsent(job.getId(), id -> new JobProgress(dto));
        synchronized (progress) {
            publish(progress, progress.start(dto, clock.instant()));
        }
    }

    /**
     * Adds row counts to a live job and notifies subscribers.
     *
     * @return the event carrying the new totals, or empty if the job is not live here
     */
    public Optional<ProgressEvent> record(UUID uploadId, long processed, long duplicates, long failed) {
        JobProgress progress = live.get(uploadId);
        if (progress == null) {
            log.debug("Ignoring progress for upload {} which is not live", uploadId);
            return Optional.empty();
        }
        synchronized (progress) {
            ProgressEvent event = progress.add(processed, duplicates, failed, clock.instant());
            publish(progress, event);
            return Optional.of(event);
        }
    }

    /**
     * Emits the terminal event, completes every subscriber and drops the live state.
     * Call after the final job row is saved.
     */
    public void finish(UUID uploadId, UploadStatus status) {
        JobProgress progress = live.remove(uploadId);
        if (progress == null) {
            return;
        }
        synchronized (progress) {
            ProgressEvent event = progress.finish(status, clock.instant());
            List<ProgressListener> listeners = List.copyOf(progress.listeners());
            progress.listeners().clear();
            dispatcher.execute(() -> listeners.forEach(listener -> {
                deliver(listener, event);
                complete(listener);
            }));
        }
        log.info("Upload {} finished with status {}", uploadId, status);
    }

    public Optional<UploadJobDTO> snapshot(UUID uploadId) {
        JobProgress progress = live.get(uploadId);
        if (progress != null) {
            return Optional.of(progress.snapshot());
        }
        return repository.findById(uploadId).map(UploadJobMapper::toDto);
    }

    /**
     * Subscribes to an upload. The listener first receives the current snapshot, then every
     * change until the terminal event. For a job that is already terminal the listener gets
     * the final snapshot and is completed straight away.
     *
     * @throws UploadNotFoundException if the upload does not exist
     */
    public Subscription subscribe(UUID uploadId, ProgressListener listener) {
        JobProgress progress = live.computeIfAbsent(uploadId, id -> repository.findById(id)
                .map(UploadJobMapper::toDto)
                .filter(job -> !job.isTerminal())
                .map(JobProgress::new)
                .orElse(null));

        if (progress == null) {
            UploadJobDTO finished = repository.findById(uploadId)
                    .map(UploadJobMapper::toDto)
                    .orElseThrow(() -> new UploadNotFoundException(uploadId));
            ProgressEvent event = ProgressEvent.snapshot(finished);
            dispatcher.execute(() -> {
                deliver(listener, event);
                complete(listener);
            });
            return () -> { };
        }

        synchronized (progress) {
            ProgressEvent first = progress.current(clock.instant());
            progress.listeners().add(listener);
            dispatcher.execute(() -> deliver(listener, first));
        }
        return () -> progress.listeners().remove(listener);
    }

    public void requestCancel(UUID uploadId) {
        JobProgress progress = live.get(uploadId);
        if (progress != null) {
            progress.requestCancel();
        }
    }

    public boolean isCancelRequested(UUID uploadId) {
        JobProgress progress = live.get(uploadId);
        return progress != null && progress.isCancelRequested();
    }

    private void publish(JobProgress progress, ProgressEvent event) {
        List<ProgressListener> listeners = List.copyOf(progress.listeners());
        if (!listeners.isEmpty()) {
            dispatcher.execute(() -> listeners.forEach(listener -> deliver(listener, event)));
        }
    }

    private void deliver(ProgressListener listener, ProgressEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for upload {}, dropping it: {}", event.getUploadId(), e.getMessage());
            live.computeIfPresent(event.getUploadId(), (id, progress) -> {
                progress.listeners().remove(listener);
                return progress;
            });
        }
    }

    private void complete(ProgressListener listener) {
        try {
            listener.onComplete();
        } catch (RuntimeException e) {
            log.warn("Progress listener completion failed: {}", e.getMessage());
        }
    }
}
