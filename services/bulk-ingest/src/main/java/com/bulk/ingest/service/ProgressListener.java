package com.bulk.ingest.service;

import com.bulk.common.model.ProgressEvent;

/**
 * Receives progress events for one upload, in order, on the reporter's dispatcher thread.
 */
public interface ProgressListener {

    void onEvent(ProgressEvent event);

    /** Called once after the terminal event, or when the subscription is dropped. */
    default void onComplete() {
    }
}
