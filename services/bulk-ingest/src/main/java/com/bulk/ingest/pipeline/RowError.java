package com.bulk.ingest.pipeline;

import java.util.Map;

import com.bulk.common.model.ErrorSeverity;

public record RowError(long rowNumber, Map<String, String> rawFields, String message, ErrorSeverity severity) {
}
