package com.bulk.ingest.model;

import java.time.Instant;
import java.util.UUID;

import com.bulk.common.model.ErrorSeverity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for processing_errors table. Append-only.
 */
@Entity
@Table(name = "processing_errors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "upload_id", columnDefinition = "uuid", nullable = false)
    private UUID uploadId;

    @Column(name = "chunk_id", columnDefinition = "uuid")
    private UUID chunkId;

    @Column(name = "row_number")
    private Long rowNumber;

    @Column(name = "raw_row", columnDefinition = "text")
    private String rawRow;

    @Column(name = "error_message", length = 2000, nullable = false)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 20, nullable = false)
    private ErrorSeverity severity;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
