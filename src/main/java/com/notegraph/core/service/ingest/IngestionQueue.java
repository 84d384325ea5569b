package com.notegraph.core.service.ingest;

import java.util.Optional;

/**
 * Bounded hand-off between the host's document events and the ingestion worker.
 *
 * An item counts as in progress from the moment it is polled until {@link #markProcessed()}
 * is called for it; persistence uses {@link #isIdle()} to wait for the pipeline to drain.
 */
public interface IngestionQueue {

    /**
     * Adds an item, waiting up to {@code timeoutMs} for free capacity.
     *
     * @return false when the queue stayed full for the whole timeout
     */
    boolean offer(IngestionWorkItem item, long timeoutMs);

    /**
     * Takes the next item, waiting up to {@code timeoutMs}.
     */
    Optional<IngestionWorkItem> poll(long timeoutMs);

    /**
     * Ends the processing of one polled item.
     */
    void markProcessed();

    /** Items waiting to be polled. */
    int pending();

    /** Polled items not yet marked processed. */
    int inProgress();

    int capacity();

    default int utilizationPercent() {
        int capacity = capacity();
        return capacity > 0 ? (pending() * 100) / capacity : 0;
    }

    default boolean isIdle() {
        return pending() == 0 && inProgress() == 0;
    }
}
