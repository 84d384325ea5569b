package com.notegraph.core.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.search.index.RetrievalIndex;
import com.notegraph.core.service.search.signal.RecentOpenTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Exports the graph, the retrieval index and the ranking signals.
 *
 * Graph and index are exported as JSON text, ranking signals as bytes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultStorageExporter implements StorageExporter {

    private final RelationshipStore relationshipStore;
    private final RetrievalIndex retrievalIndex;
    private final RecentOpenTracker recentOpenTracker;
    private final ObjectMapper objectMapper;

    @Override
    @Async("exportExecutor")
    public CompletableFuture<Map<StorageDomain, StoragePayload>> export(Set<StorageDomain> domains) {
        try {
            var payloads = new EnumMap<StorageDomain, StoragePayload>(StorageDomain.class);
            for (var domain : domains) {
                payloads.put(domain, exportDomain(domain));
            }
            log.debug("Exported {}", payloads.keySet());
            return CompletableFuture.completedFuture(payloads);
        } catch (RuntimeException e) {
            log.error("Export of {} failed", domains, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private StoragePayload exportDomain(StorageDomain domain) {
        return switch (domain) {
            case GRAPH -> new StoragePayload.Text(exportGraph());
            case VECTOR_INDEX -> new StoragePayload.Text(retrievalIndex.exportSnapshot());
            case RELATIONAL_METADATA -> new StoragePayload.Binary(recentOpenTracker.exportSnapshot());
        };
    }

    private String exportGraph() {
        try {
            return objectMapper.writeValueAsString(relationshipStore.snapshot());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph snapshot", e);
        }
    }
}
