package com.notegraph.core.service.persistence.store;

import java.util.Optional;

/**
 * Destination for binary snapshots.
 */
public interface BytesStore {

    /**
     * Replaces the stored content.
     *
     * @throws java.io.UncheckedIOException if the content cannot be written
     */
    void save(byte[] content);

    /**
     * Returns the stored content, empty when nothing was saved yet.
     */
    Optional<byte[]> load();
}
