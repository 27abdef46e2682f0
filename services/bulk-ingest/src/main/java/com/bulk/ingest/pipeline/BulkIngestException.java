package com.bulk.ingest.pipeline;

/**
 * Base class for failures raised by the ingest pipeline itself (as opposed to
 * {@link org.springframework.dao.DataAccessException}s coming out of the database layer).
 */
public class BulkIngestException extends RuntimeException {

    public BulkIngestException(String message) {
        super(message);
    }

    public BulkIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
