package com.notegraph.core.service.persistence;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Produces serialized snapshots of the requested storage domains.
 */
public interface StorageExporter {

    /**
     * Exports the given domains.
     *
     * @param domains the domains to export
     * @return a future holding one payload per requested domain
     */
    CompletableFuture<Map<StorageDomain, StoragePayload>> export(Set<StorageDomain> domains);
}
