package com.bulk.ingest.pipeline;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;

/**
 * Content-hash deduplication. A hash is recorded the first time it is seen; every later
 * occurrence, in the same file or any other upload, is a duplicate.
 */
@Slf4j
public class DeduplicationService {

    private final ContentHasher hasher;
    private final DedupStore store;

    public DeduplicationService(ContentHasher hasher, DedupStore store) {
        this.hasher = hasher;
        this.store = store;
    }

    public String contentHash(InvoiceLine line) {
        return hasher.hash(line);
    }

    /**
     * Atomic check-and-insert on the caller's transaction.
     *
     * @return {@code true} if the hash was not known before this call
     */
    public boolean checkAndMark(Connection connection, String hash, UUID uploadId) throws SQLException {
        return store.insertIfAbsent(connection, List.of(hash), uploadId)[0];
    }

    /**
     * Batch form of {@link #checkAndMark}. Lines without a hash get one computed.
     *
     * @return the lines seen for the first time, in input order
     */
    public List<InvoiceLine> checkAndMarkAll(Connection connection, List<InvoiceLine> lines, UUID uploadId)
            throws SQLException {
        List<String> hashes = new ArrayList<>(lines.size());
        for (InvoiceLine line : lines) {
            hashes.add(hashOf(line));
        }
        boolean[] fresh = store.insertIfAbsent(connection, hashes, uploadId);
        List<InvoiceLine> firstSeen = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (fresh[i]) {
                firstSeen.add(lines.get(i));
            }
        }
        if (firstSeen.size() < lines.size()) {
            log.debug("Upload {}: {} of {} rows already seen", uploadId, lines.size() - firstSeen.size(), lines.size());
        }
        return firstSeen;
    }

    String hashOf(InvoiceLine line) {
        if (line.getContentHash() == null) {
            line.setContentHash(hasher.hash(line));
        }
        return line.getContentHash();
    }
}
