package com.bulk.ingest.pipeline;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

public class JdbcDedupStore implements DedupStore {

    static final String INSERT_SQL = "INSERT INTO dedup_records (content_hash, upload_id, first_seen_at) "
            + "VALUES (?, ?, CURRENT_TIMESTAMP) ON CONFLICT (content_hash) DO NOTHING";

    @Override
    public boolean[] insertIfAbsent(Connection connection, List<String> hashes, UUID uploadId) throws SQLException {
        boolean[] inserted = new boolean[hashes.size()];
        if (hashes.isEmpty()) {
            return inserted;
        }
        try (PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (String hash : hashes) {
                statement.setString(1, hash);
                statement.setObject(2, uploadId);
                statement.addBatch();
            }
            int[] counts = statement.executeBatch();
            for (int i = 0; i < counts.length; i++) {
                if (counts[i] == Statement.SUCCESS_NO_INFO) {
                    throw new IllegalStateException("Driver did not report update counts for dedup batch");
                }
                inserted[i] = counts[i] > 0;
            }
        }
        return inserted;
    }
}
