package com.bulk.ingest.service;

/**
 * Handle for a progress subscription. Closing it stops further events.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
