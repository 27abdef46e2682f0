package com.bulk.ingest.service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.bulk.common.model.ProgressEvent;
import com.bulk.common.model.UploadJobDTO;
import com.bulk.common.model.UploadStatus;

/**
 * Live counters of one upload. All mutation happens under the instance lock so events
 * are built from consistent totals.
 */
class JobProgress {

    private final UploadJobDTO base;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelRequested;

    private UploadStatus status;
    private long processedRows;
    private long duplicateRows;
    private long failedRows;

    JobProgress(UploadJobDTO base) {
        this.base = base;
        this.status = base.getStatus();
        this.processedRows = base.getProcessedRows();
        this.duplicateRows = base.getDuplicateRows();
        this.failedRows = base.getFailedRows();
        this.cancelRequested = base.isCancelRequested();
    }

    synchronized ProgressEvent start(UploadJobDTO job, Instant at) {
        base.setStartedAt(job.getStartedAt());
        base.setTotalRows(job.getTotalRows());
        status = UploadStatus.PROCESSING;
        processedRows = 0;
        duplicateRows = 0;
        failedRows = 0;
        return event(0, 0, 0, at);
    }

    synchronized ProgressEvent add(long processed, long duplicates, long failed, Instant at) {
        processedRows += processed;
        duplicateRows += duplicates;
        failedRows += failed;
        return event(processed, duplicates, failed, at);
    }

    synchronized ProgressEvent finish(UploadStatus finalStatus, Instant at) {
        status = finalStatus;
        return event(0, 0, 0, at);
    }

    synchronized ProgressEvent current(Instant at) {
        return event(0, 0, 0, at);
    }

    synchronized UploadJobDTO snapshot() {
        return base.toBuilder()
                .status(status)
                .processedRows(processedRows)
                .duplicateRows(duplicateRows)
                .failedRows(failedRows)
                .cancelRequested(cancelRequested)
                .build();
    }

    List<ProgressListener> listeners() {
        return listeners;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    private ProgressEvent event(long processed, long duplicates, long failed, Instant at) {
        return ProgressEvent.builder()
                .uploadId(base.getUploadId())
                .status(status)
                .processedDelta(processed)
                .duplicateDelta(duplicates)
                .failedDelta(failed)
                .processedRows(processedRows)
                .duplicateRows(duplicateRows)
                .failedRows(failedRows)
                .totalRows(base.getTotalRows())
                .terminal(status.isTerminal())
                .timestamp(at)
                .build();
    }
}
