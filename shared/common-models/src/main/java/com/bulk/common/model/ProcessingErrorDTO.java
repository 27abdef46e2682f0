package com.bulk.common.model;

import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingErrorDTO {

    private UUID uploadId;

    private UUID chunkId;

    private Long rowNumber;

    private String rawRow;

    private String errorMessage;

    private ErrorSeverity severity;

    private Instant createdAt;
}
