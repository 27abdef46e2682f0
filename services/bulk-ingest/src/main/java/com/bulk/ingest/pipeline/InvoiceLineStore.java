package com.bulk.ingest.pipeline;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * Sink for validated invoice lines, keyed by (invoice_no, store_name, item_name, batch_no).
 */
public interface InvoiceLineStore {

    /**
     * Inserts or updates the lines in statement order on the caller's connection.
     *
     * @return number of lines written
     */
    int upsert(Connection connection, List<InvoiceLine> lines, UUID uploadId) throws SQLException;
}
