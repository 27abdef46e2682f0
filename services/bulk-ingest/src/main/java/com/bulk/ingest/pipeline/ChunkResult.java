package com.bulk.ingest.pipeline;

import java.util.List;

import com.bulk.common.model.ErrorSeverity;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one committed chunk transaction.
 */
@Value
@Builder
public class ChunkResult {

    int inserted;
    int duplicates;
    int failed;

    @Builder.Default
    List<RowError> errors = List.of();

    /**
     * Every row of the chunk failed with the same cause.
     */
    public static ChunkResult allFailed(ChunkWork work, String message, ErrorSeverity severity) {
        List<RowError> errors = work.lines().stream()
                .map(line -> new RowError(line.getRowNumber(), line.getRawFields(), message, severity))
                .toList();
        return ChunkResult.builder()
                .failed(work.size())
                .errors(errors)
                .build();
    }
}
