package com.bulk.ingest.broker;

import com.bulk.ingest.pipeline.BulkIngestException;

/**
 * A publish to the job queue failed or timed out.
 */
public class BrokerUnavailableException extends BulkIngestException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
