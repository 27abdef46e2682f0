package com.bulk.common.model;

import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress delta pushed to subscribers of an upload job.
 * Carries both the delta since the previous event and the running totals, so a
 * subscriber that joins mid-job only needs the latest event to be consistent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {

    private UUID uploadId;

    private UploadStatus status;

    private long processedDelta;

    private long duplicateDelta;

    private long failedDelta;

    private long processedRows;

    private long duplicateRows;

    private long failedRows;

    private long totalRows;

    private boolean terminal;

    private Instant timestamp;

    public static ProgressEvent snapshot(UploadJobDTO job) {
        return ProgressEvent.builder()
                .uploadId(job.getUploadId())
                .status(job.getStatus())
                .processedRows(job.getProcessedRows())
                .duplicateRows(job.getDuplicateRows())
                .failedRows(job.getFailedRows())
                .totalRows(job.getTotalRows())
                .terminal(job.isTerminal())
                .timestamp(Instant.now())
                .build();
    }
}
