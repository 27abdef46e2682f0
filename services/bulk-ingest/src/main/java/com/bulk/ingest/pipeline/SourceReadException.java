package com.bulk.ingest.pipeline;

public class SourceReadException extends BulkIngestException {

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
