package com.notegraph.core.service.persistence;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Tracks dirty storage domains and writes them out in coalesced flush cycles.
 */
public interface PersistenceScheduler {

    /**
     * Marks the given domains dirty. Nothing is written until a flush runs.
     */
    void schedule(Set<StorageDomain> domains);

    default void schedule(StorageDomain first, StorageDomain... rest) {
        schedule(EnumSet.of(first, rest));
    }

    /**
     * Arms (or re-arms) the idle timer with the configured timeout.
     */
    void flushWhenIdle();

    /**
     * Arms (or re-arms) the idle timer. Only the last call before expiry leads to a flush.
     */
    void flushWhenIdle(long idleTimeoutMs);

    /**
     * Writes every dirty domain.
     *
     * Concurrent callers share the running flush; a call made while a flush runs triggers
     * one more cycle for whatever became dirty in the meantime.
     *
     * @return a future completing after the last cycle, exceptionally when a cycle fails
     */
    CompletableFuture<Void> flush();

    /**
     * Cancels the pending idle timer. A running flush is not affected.
     */
    void dispose();

    PersistenceStatus status();

    /**
     * Point-in-time view of the scheduler.
     *
     * @param dirtyDomains     domains waiting for the next flush
     * @param flushInProgress  whether a flush cycle is running
     * @param idleFlushPending whether the idle timer is armed
     * @param lastFailure      message of the last failed cycle, null after a successful one
     */
    record PersistenceStatus(Set<StorageDomain> dirtyDomains,
                             boolean flushInProgress,
                             boolean idleFlushPending,
                             String lastFailure) {
    }
}
