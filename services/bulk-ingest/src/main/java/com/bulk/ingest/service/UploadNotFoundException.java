package com.bulk.ingest.service;

import java.util.UUID;

import com.bulk.ingest.pipeline.BulkIngestException;

public class UploadNotFoundException extends BulkIngestException {

    public UploadNotFoundException(UUID uploadId) {
        super("Upload not found: " + uploadId);
    }
}
