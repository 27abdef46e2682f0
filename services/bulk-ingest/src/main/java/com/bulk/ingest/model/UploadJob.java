package com.bulk.ingest.model;

import java.time.Instant;
import java.util.UUID;

import com.bulk.common.model.UploadStatus;
import com.github.f4b6a3.uuid.UuidCreator;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for upload_jobs table.
 */
@Entity
@Table(name = "upload_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadJob {

    @Id
    @Column(name = "id", columnDefinition = "uuid", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "file_name", length = 255, nullable = false)
    private String fileName;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "declared_row_count", nullable = false)
    private Long declaredRowCount;

    @Column(name = "staged_path", length = 1024)
    private String stagedPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30, nullable = false)
    private UploadStatus status;

    @Column(name = "processed_rows", nullable = false)
    private Long processedRows;

    @Column(name = "duplicate_rows", nullable = false)
    private Long duplicateRows;

    @Column(name = "failed_rows", nullable = false)
    private Long failedRows;

    @Column(name = "cancel_requested", nullable = false)
    private Boolean cancelRequested;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "owner_id", length = 100, nullable = false)
    private String ownerId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Moves the job to {@code next}, refusing regressions out of a terminal status.
     */
    public void transitionTo(UploadStatus next, Instant at) {
        if (status == next) {
            return;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Upload " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        updatedAt = at;
        if (next == UploadStatus.PROCESSING && startedAt == null) {
            startedAt = at;
        }
        if (next.isTerminal()) {
            completedAt = at;
        }
    }

    // Timestamps are stamped by the services from the shared Clock, never here.
    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UuidCreator.getTimeOrdered();
        }
        if (status == null) {
            status = UploadStatus.PENDING;
        }
        if (processedRows == null) {
            processedRows = 0L;
        }
        if (duplicateRows == null) {
            duplicateRows = 0L;
        }
        if (failedRows == null) {
            failedRows = 0L;
        }
        if (cancelRequested == null) {
            cancelRequested = false;
        }
    }
}
