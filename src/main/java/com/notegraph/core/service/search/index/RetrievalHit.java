package com.notegraph.core.service.search.index;

/**
 * A candidate returned by the retrieval index.
 */
public record RetrievalHit(
        String documentId,
        String path,
        String title,
        String content,
        String docType,
        long modifiedTime,
        double score
) {

    public RetrievalHit withScore(double newScore) {
        return new RetrievalHit(documentId, path, title, content, docType, modifiedTime, newScore);
    }
}
