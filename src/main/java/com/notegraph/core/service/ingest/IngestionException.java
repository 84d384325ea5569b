package com.notegraph.core.service.ingest;

/**
 * A document change that could not be queued or applied.
 */
public class IngestionException extends RuntimeException {

    public enum Reason {
        QUEUE_FULL,
        INVALID_EMBEDDING,
        UPSERT_FAILED,
        REMOVAL_FAILED
    }

    private final Reason reason;
    private final String documentId;

    public IngestionException(Reason reason, String documentId, String message) {
        this(reason, documentId, message, null);
    }

    public IngestionException(Reason reason, String documentId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.documentId = documentId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getDocumentId() {
        return documentId;
    }
}
