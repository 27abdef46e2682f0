package com.bulk.ingest.service;

import java.util.Map;

import com.bulk.common.model.ProcessingErrorDTO;
import com.bulk.common.model.UploadJobDTO;
import com.bulk.ingest.model.ProcessingError;
import com.bulk.ingest.model.UploadJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Entity to DTO conversions shared by the query and reporting paths.
 */
@Slf4j
final class UploadJobMapper {

    private UploadJobMapper() {
    }

    static UploadJobDTO toDto(UploadJob job) {
        return UploadJobDTO.builder()
                .uploadId(job.getId())
                .fileName(job.getFileName())
                .fileSize(job.getFileSize())
                .ownerId(job.getOwnerId())
                .status(job.getStatus())
                .totalRows(valueOf(job.getDeclaredRowCount()))
                .processedRows(valueOf(job.getProcessedRows()))
                .duplicateRows(valueOf(job.getDuplicateRows()))
                .failedRows(valueOf(job.getFailedRows()))
                .cancelRequested(Boolean.TRUE.equals(job.getCancelRequested()))
                .failureReason(job.getFailureReason())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }

    static ProcessingErrorDTO toDto(ProcessingError error) {
        return ProcessingErrorDTO.builder()
                .uploadId(error.getUploadId())
                .chunkId(error.getChunkId())
                .rowNumber(error.getRowNumber())
                .rawRow(error.getRawRow())
                .errorMessage(error.getErrorMessage())
                .severity(error.getSeverity())
                .createdAt(error.getCreatedAt())
                .build();
    }

    static String rawRowJson(ObjectMapper objectMapper, Map<String, String> rawFields) {
        if (rawFields == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(rawFields);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize raw row snapshot: {}", e.getMessage());
            return String.valueOf(rawFields);
        }
    }

    private static long valueOf(Long value) {
        return value == null ? 0L : value;
    }
}
