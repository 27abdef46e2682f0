package com.bulk.common.model;

import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time snapshot of an upload job.
 * Used for the status endpoint and as the first frame of a progress stream.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadJobDTO {

    private UUID uploadId;

    private String fileName;

    private Long fileSize;

    private String ownerId;

    private UploadStatus status;

    private long totalRows;

    private long processedRows;

    private long duplicateRows;

    private long failedRows;

    private boolean cancelRequested;

    private String failureReason;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
