package com.notegraph.core.service.ingest;

import com.notegraph.core.service.config.IngestionConfig;
import com.notegraph.core.service.persistence.PersistenceScheduler;
import com.notegraph.core.service.persistence.StorageDomain;
import com.notegraph.core.service.search.signal.RecentOpenTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for the host's document events.
 *
 * Content changes are queued for the ingestion worker; opens are recorded directly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final IngestionQueue queue;
    private final RecentOpenTracker recentOpenTracker;
    private final PersistenceScheduler persistenceScheduler;
    private final IngestionConfig ingestionConfig;

    /**
     * Queues a created or changed document.
     *
     * @throws IngestionException with reason {@code QUEUE_FULL} when the queue stays full past the offer timeout
     */
    public void submitUpsert(DocumentPayload document) {
        enqueue(new IngestionWorkItem.DocumentUpsertWorkItem(document));
    }

    /**
     * Queues a document deletion.
     *
     * @throws IngestionException with reason {@code QUEUE_FULL} when the queue stays full past the offer timeout
     */
    public void submitRemoval(String documentId, String path) {
        enqueue(new IngestionWorkItem.DocumentRemovalWorkItem(documentId, path));
    }

    /**
     * Records that the user opened a document; feeds the frequency and recency boosts.
     */
    public void onDocumentOpened(String path) {
        var signal = recentOpenTracker.recordOpen(path);
        log.debug("Recorded open of {} (count {})", path, signal.openCount());
        persistenceScheduler.schedule(StorageDomain.RELATIONAL_METADATA);
        persistenceScheduler.flushWhenIdle();
    }

    private void enqueue(IngestionWorkItem item) {
        long timeoutMs = ingestionConfig.getQueue().getOfferTimeoutMs();
        if (!queue.offer(item, timeoutMs)) {
            throw new IngestionException(IngestionException.Reason.QUEUE_FULL, item.getEntityId(),
                    "Ingestion queue is full (capacity " + queue.capacity() + ")");
        }
    }
}
