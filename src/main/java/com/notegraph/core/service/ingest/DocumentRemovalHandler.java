package com.notegraph.core.service.ingest;

import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.persistence.PersistenceScheduler;
import com.notegraph.core.service.persistence.StorageDomain;
import com.notegraph.core.service.search.index.RetrievalIndex;
import com.notegraph.core.service.search.signal.RecentOpenTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Removes a deleted document from the graph, the index and the ranking signals.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRemovalHandler implements IngestionHandler<IngestionWorkItem.DocumentRemovalWorkItem> {

    private final RelationshipStore relationshipStore;
    private final RetrievalIndex retrievalIndex;
    private final RecentOpenTracker recentOpenTracker;
    private final PersistenceScheduler persistenceScheduler;
    private final MetricsConfig metricsConfig;

    @Override
    public void handle(IngestionWorkItem.DocumentRemovalWorkItem workItem) {
        var documentId = workItem.documentId();
        try {
            relationshipStore.removeDocument(documentId);
            boolean indexed = retrievalIndex.remove(documentId);
            if (workItem.path() != null) {
                recentOpenTracker.forget(workItem.path());
            }

            persistenceScheduler.schedule(
                    StorageDomain.GRAPH, StorageDomain.VECTOR_INDEX, StorageDomain.RELATIONAL_METADATA);
            persistenceScheduler.flushWhenIdle();
            metricsConfig.getDocumentsRemoved().increment();
            log.debug("Removed document {} (indexed: {})", documentId, indexed);
        } catch (RuntimeException e) {
            throw new IngestionException(IngestionException.Reason.REMOVAL_FAILED, documentId,
                    "Failed to remove document: " + e.getMessage(), e);
        }
    }

    @Override
    public Class<IngestionWorkItem.DocumentRemovalWorkItem> getSupportedType() {
        return IngestionWorkItem.DocumentRemovalWorkItem.class;
    }
}
