package com.notegraph.core.service.persistence.store;

import java.util.Optional;

/**
 * Destination for textual (JSON) snapshots.
 */
public interface TextStore {

    void save(String content);

    Optional<String> load();
}
