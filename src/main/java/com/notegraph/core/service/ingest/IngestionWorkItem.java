package com.notegraph.core.service.ingest;

import java.time.Instant;

/**
 * Sealed interface for ingestion work items.
 *
 * Uses the sealed interface pattern to define a closed hierarchy
 * of work item types that can be processed by the ingestion pipeline.
 */
public sealed interface IngestionWorkItem permits
        IngestionWorkItem.DocumentUpsertWorkItem,
        IngestionWorkItem.DocumentRemovalWorkItem {

    /**
     * Gets the document ID for this work item.
     */
    String getEntityId();

    /**
     * Gets the timestamp when this item was created.
     */
    Instant getCreatedAt();

    /**
     * A document was created or changed.
     */
    record DocumentUpsertWorkItem(
            DocumentPayload document,
            Instant createdAt
    ) implements IngestionWorkItem {

        public DocumentUpsertWorkItem(DocumentPayload document) {
            this(document, Instant.now());
        }

        @Override
        public String getEntityId() {
            return document.id();
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }
    }

    /**
     * A document was deleted.
     */
    record DocumentRemovalWorkItem(
            String documentId,
            String path,
            Instant createdAt
    ) implements IngestionWorkItem {

        public DocumentRemovalWorkItem(String documentId, String path) {
            this(documentId, path, Instant.now());
        }

        @Override
        public String getEntityId() {
            return documentId;
        }

        @Override
        public Instant getCreatedAt() {
            return createdAt;
        }
    }
}
