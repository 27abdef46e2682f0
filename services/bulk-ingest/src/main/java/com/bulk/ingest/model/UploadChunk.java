package com.bulk.ingest.model;

import java.time.Instant;
import java.util.UUID;

import com.bulk.common.model.ChunkStatus;
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
 * JPA Entity for upload_chunks table.
 * A chunk covers the data rows [rowStart, rowEnd) of its job; ranges never overlap.
 */
@Entity
@Table(name = "upload_chunks")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadChunk {

    @Id
    @Column(name = "id", columnDefinition = "uuid", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "upload_id", columnDefinition = "uuid", nullable = false)
    private UUID uploadId;

    @Column(name = "chunk_index", nullable = false)
    private Integer chunkIndex;

    @Column(name = "row_start", nullable = false)
    private Long rowStart;

    @Column(name = "row_end", nullable = false)
    private Long rowEnd;

    @Column(name = "row_count", nullable = false)
    private Integer rowCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private ChunkStatus status;

    @Column(name = "attempt_count", nullable = false)
    private Integer attemptCount;

    @Column(name = "inserted_rows")
    private Integer insertedRows;

    @Column(name = "duplicate_rows")
    private Integer duplicateRows;

    @Column(name = "failed_rows")
    private Integer failedRows;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UuidCreator.getTimeOrdered();
        }
        if (status == null) {
            status = ChunkStatus.QUEUED;
        }
        if (attemptCount == null) {
            attemptCount = 0;
        }
    }
}
