package com.notegraph.core.service.ingest;

import com.notegraph.core.service.config.MetricsConfig;
import com.notegraph.core.service.config.SearchConfig;
import com.notegraph.core.service.graph.RelationshipStore;
import com.notegraph.core.service.graph.model.MarkdownDocument;
import com.notegraph.core.service.ingest.IngestionException.Reason;
import com.notegraph.core.service.persistence.PersistenceScheduler;
import com.notegraph.core.service.persistence.StorageDomain;
import com.notegraph.core.service.search.index.IndexedDocument;
import com.notegraph.core.service.search.index.RetrievalIndex;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Projects a changed document into the relationship graph and the retrieval index,
 * then marks both dirty and arms the idle flush.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentUpsertHandler implements IngestionHandler<IngestionWorkItem.DocumentUpsertWorkItem> {

    private static final String DEFAULT_DOC_TYPE = "markdown";

    private final RelationshipStore relationshipStore;
    private final RetrievalIndex retrievalIndex;
    private final PersistenceScheduler persistenceScheduler;
    private final SearchConfig searchConfig;
    private final MetricsConfig metricsConfig;

    @Override
    public void handle(IngestionWorkItem.DocumentUpsertWorkItem workItem) {
        var document = workItem.document();
        validateEmbedding(document);

        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            log.debug("Indexing document {} ({})", document.id(), document.path());
            var docType = document.docType() != null ? document.docType() : DEFAULT_DOC_TYPE;

            relationshipStore.upsertMarkdownDocument(MarkdownDocument.builder()
                    .id(document.id())
                    .path(document.path())
                    .content(document.content())
                    .docType(docType)
                    .categories(document.categories())
                    .build());

            retrievalIndex.upsert(IndexedDocument.builder()
                    .id(document.id())
                    .path(document.path())
                    .title(document.title())
                    .content(document.content())
                    .docType(docType)
                    .modifiedTime(document.modifiedTime())
                    .embedding(document.embedding())
                    .build());

            persistenceScheduler.schedule(StorageDomain.GRAPH, StorageDomain.VECTOR_INDEX);
            persistenceScheduler.flushWhenIdle();
            metricsConfig.getDocumentsIngested().increment();
        } catch (RuntimeException e) {
            throw new IngestionException(Reason.UPSERT_FAILED, document.id(),
                    "Failed to index document: " + e.getMessage(), e);
        } finally {
            sample.stop(metricsConfig.getIngestionTimer());
        }
    }

    @Override
    public Class<IngestionWorkItem.DocumentUpsertWorkItem> getSupportedType() {
        return IngestionWorkItem.DocumentUpsertWorkItem.class;
    }

    private void validateEmbedding(DocumentPayload document) {
        var embedding = document.embedding();
        int expected = searchConfig.getEmbeddingDimension();
        if (embedding != null && embedding.length != expected) {
            throw new IngestionException(Reason.INVALID_EMBEDDING, document.id(),
                    "Embedding dimension mismatch: expected %d, got %d".formatted(expected, embedding.length));
        }
    }
}
