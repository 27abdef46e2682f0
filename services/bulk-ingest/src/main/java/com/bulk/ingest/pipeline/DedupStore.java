package com.bulk.ingest.pipeline;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

/**
 * First-seen registry of content hashes. Writes happen on the caller's connection so they
 * commit or roll back together with the sink rows.
 */
public interface DedupStore {

    /**
     * Inserts every hash that is not yet known.
     *
     * @return one flag per input hash, {@code true} where this call inserted it
     */
    boolean[] insertIfAbsent(Connection connection, List<String> hashes, UUID uploadId) throws SQLException;
}
