package com.bulk.ingest.pipeline;

import java.util.List;

import lombok.Getter;

/**
 * The header row lacks one or more required columns. Fails the whole job.
 */
@Getter
public class SchemaException extends BulkIngestException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("Missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }
}
